package org.catalogregistry.harvest.pipeline.sysprof;

import java.util.List;

import lombok.Builder;

/**
 * Descriptive identification of this registry service, as published to catalog consumers.
 */
@Builder(toBuilder = true)
public record ServiceProfile(
    String title,
    String abstractText,
    List<String> keywords,
    String keywordsType,
    String fees,
    String accessConstraints,
    String providerName,
    String providerUrl,
    String contactName,
    String contactPosition,
    String contactEmail,
    String contactUrl,
    String contactRole,
    List<String> profiles
) {
    public static ServiceProfile defaults() {
        return ServiceProfile.builder()
            .title("Registry")
            .abstractText("Registry is a CSW catalogue with faceting capabilities via OpenSearch")
            .keywords(List.of("registry", "csw"))
            .keywordsType("theme")
            .fees("None")
            .accessConstraints("None")
            .providerName("Organization Name")
            .contactName("Lastname, Firstname")
            .contactPosition("Position Title")
            .contactEmail("Email Address")
            .contactRole("pointOfContact")
            .profiles(List.of("apiso"))
            .build();
    }
}
