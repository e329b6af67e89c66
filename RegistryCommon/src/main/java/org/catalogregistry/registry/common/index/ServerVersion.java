package org.catalogregistry.registry.common.index;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Version of the search server, as reported by {@code GET /}.
 *
 * OpenSearch restarted its numbering at 1.0 from Elasticsearch 7.10, so every
 * OpenSearch release behaves like a 7.x Elasticsearch for mapping purposes.
 */
public record ServerVersion(String distribution, String number, int major, int minor) {
    public static final String OPENSEARCH = "opensearch";
    public static final String ELASTICSEARCH = "elasticsearch";

    public static ServerVersion parse(JsonNode rootResponse) {
        var version = rootResponse.path("version");
        var number = version.path("number").asText(null);
        if (number == null || number.isBlank()) {
            throw new IllegalArgumentException("Response carries no version.number: " + rootResponse);
        }
        var distribution = version.path("distribution").asText(ELASTICSEARCH);
        return of(distribution, number);
    }

    public static ServerVersion of(String distribution, String number) {
        var parts = number.split("[.-]");
        try {
            var major = Integer.parseInt(parts[0]);
            var minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return new ServerVersion(distribution, number, major, minor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unparseable server version " + number, e);
        }
    }

    private int effectiveMajor() {
        return OPENSEARCH.equalsIgnoreCase(distribution) ? 7 : major;
    }

    /** Servers from 5.x on know the {@code text} type; older ones use analyzed strings. */
    public boolean hasTextType() {
        return effectiveMajor() >= 5;
    }

    /** Servers from 7.x on reject mapping types. */
    public boolean isTypeless() {
        return effectiveMajor() >= 7;
    }

    /** Prefix-tree geo_shape settings ({@code tree}, {@code precision}) are only honored before 7.x. */
    public boolean supportsShapePrecision() {
        return effectiveMajor() < 7;
    }

    @Override
    public String toString() {
        return distribution + " " + number;
    }
}
