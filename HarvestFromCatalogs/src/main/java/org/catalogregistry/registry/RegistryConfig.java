package org.catalogregistry.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.sysprof.ServiceProfile;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings of a registry installation, read from YAML and overridden by the environment.
 *
 * <pre>
 * searchUrl: http://127.0.0.1:9200
 * databaseUrl: jdbc:duckdb:/var/lib/registry/registry.db
 * maxConcurrentSources: 4
 * sources:
 *   - name: east
 *     type: csw
 *     url: http://east.example.org/csw
 *     mode: incremental
 * </pre>
 */
@Slf4j
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryConfig {
    public static final String DEFAULT_SEARCH_URL = "http://127.0.0.1:9200";
    public static final String DEFAULT_DATABASE_URL = "jdbc:duckdb:/tmp/registry.db";
    public static final String DEFAULT_MAPPING_PRECISION = "500m";

    public static final String ENV_SEARCH_URL = "REGISTRY_SEARCH_URL";
    public static final String ENV_DATABASE_URL = "REGISTRY_DATABASE_URL";
    public static final String ENV_MAPPING_PRECISION = "REGISTRY_MAPPING_PRECISION";
    public static final String ENV_VCAP_SERVICES = "VCAP_SERVICES";
    public static final String ENV_CONFIG = "REGISTRY_CONFIG";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private String searchUrl = DEFAULT_SEARCH_URL;
    private boolean searchInsecure;
    private String databaseUrl = DEFAULT_DATABASE_URL;
    private String mappingPrecision = DEFAULT_MAPPING_PRECISION;
    private int maxConcurrentSources = 4;
    private int recordConcurrency = 4;
    private long leaseTimeoutSeconds = 30;
    private int bulkMaxDocs = 500;
    private List<SourceConfig> sources = new ArrayList<>();
    private ProfileConfig profile = new ProfileConfig();

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceConfig {
        private String name;
        private String type = "csw";
        private String url;
        private String path;
        private String catalog;
        private String mode = "full";
        private int pageSize = SourceEndpoint.DEFAULT_PAGE_SIZE;
        private boolean allowPartialListing;

        public SourceEndpoint toEndpoint() {
            if (mode != null && !"full".equalsIgnoreCase(mode) && !"incremental".equalsIgnoreCase(mode)) {
                throw new IllegalArgumentException("Unknown harvest mode '" + mode + "' of source " + name);
            }
            if (SourceEndpoint.isReserved(name)) {
                throw new IllegalArgumentException("Source name '" + name + "' is reserved for the service profile");
            }
            return SourceEndpoint.builder()
                .name(name)
                .type(type)
                .location(url != null ? url : path)
                .catalog(catalog)
                .incremental("incremental".equalsIgnoreCase(mode))
                .pageSize(pageSize)
                .allowPartialListing(allowPartialListing)
                .build();
        }
    }

    /** Service identification published by {@code get_sysprof}; unset fields keep their defaults. */
    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfig {
        private String title;
        @JsonProperty("abstract")
        private String abstractText;
        private List<String> keywords;
        private String keywordsType;
        private String fees;
        private String accessConstraints;
        private String providerName;
        private String providerUrl;
        private String contactName;
        private String contactPosition;
        private String contactEmail;
        private String contactUrl;
        private String contactRole;

        public ServiceProfile toServiceProfile() {
            var defaults = ServiceProfile.defaults();
            return defaults.toBuilder()
                .title(Optional.ofNullable(title).orElse(defaults.title()))
                .abstractText(Optional.ofNullable(abstractText).orElse(defaults.abstractText()))
                .keywords(Optional.ofNullable(keywords).orElse(defaults.keywords()))
                .keywordsType(Optional.ofNullable(keywordsType).orElse(defaults.keywordsType()))
                .fees(Optional.ofNullable(fees).orElse(defaults.fees()))
                .accessConstraints(Optional.ofNullable(accessConstraints).orElse(defaults.accessConstraints()))
                .providerName(Optional.ofNullable(providerName).orElse(defaults.providerName()))
                .providerUrl(Optional.ofNullable(providerUrl).orElse(defaults.providerUrl()))
                .contactName(Optional.ofNullable(contactName).orElse(defaults.contactName()))
                .contactPosition(Optional.ofNullable(contactPosition).orElse(defaults.contactPosition()))
                .contactEmail(Optional.ofNullable(contactEmail).orElse(defaults.contactEmail()))
                .contactUrl(Optional.ofNullable(contactUrl).orElse(defaults.contactUrl()))
                .contactRole(Optional.ofNullable(contactRole).orElse(defaults.contactRole()))
                .build();
        }
    }

    /**
     * Read the YAML file, when given, then apply the environment.
     *
     * @param file configuration file, or null for defaults only
     */
    public static RegistryConfig load(Path file, Map<String, String> env) throws IOException {
        RegistryConfig config;
        if (file == null) {
            config = new RegistryConfig();
        } else {
            log.info("Reading configuration from {}", file);
            try (var in = Files.newInputStream(file)) {
                config = YAML_MAPPER.readValue(in, RegistryConfig.class);
            }
            if (config == null) {
                config = new RegistryConfig();
            }
        }
        config.applyEnvironment(env);
        return config;
    }

    void applyEnvironment(Map<String, String> env) {
        Optional.ofNullable(env.get(ENV_SEARCH_URL)).filter(v -> !v.isBlank()).ifPresent(this::setSearchUrl);
        Optional.ofNullable(env.get(ENV_DATABASE_URL)).filter(v -> !v.isBlank()).ifPresent(this::setDatabaseUrl);
        Optional.ofNullable(env.get(ENV_MAPPING_PRECISION)).filter(v -> !v.isBlank())
            .ifPresent(this::setMappingPrecision);
        vcapSearchUrl(env.get(ENV_VCAP_SERVICES)).ifPresent(url -> {
            log.info("Using the search service bound in {}", ENV_VCAP_SERVICES);
            setSearchUrl(url);
        });
        if (profile == null) {
            profile = new ProfileConfig();
        }
        if (sources == null) {
            sources = new ArrayList<>();
        }
    }

    /** The {@code sslUri} of the first bound {@code searchly} service, if any. */
    static Optional<String> vcapSearchUrl(String vcapServices) {
        if (vcapServices == null || vcapServices.isBlank()) {
            return Optional.empty();
        }
        JsonNode services;
        try {
            services = JSON_MAPPER.readTree(vcapServices);
        } catch (IOException e) {
            throw new IllegalArgumentException(ENV_VCAP_SERVICES + " is not valid JSON: " + e.getMessage(), e);
        }
        var uri = services.path("searchly").path(0).path("credentials").path("sslUri");
        return uri.isTextual() ? Optional.of(uri.asText()) : Optional.empty();
    }

    public Duration getLeaseTimeout() {
        return Duration.ofSeconds(leaseTimeoutSeconds);
    }

    public List<SourceEndpoint> endpoints() {
        var endpoints = new ArrayList<SourceEndpoint>();
        for (var source : sources) {
            endpoints.add(source.toEndpoint());
        }
        return endpoints;
    }

    /** The catalog a source's documents live in; sources that are not configured use their own name. */
    public String catalogOf(String sourceName) {
        return sources.stream()
            .filter(s -> sourceName.equals(s.getName()))
            .findFirst()
            .map(s -> s.toEndpoint().catalog())
            .orElse(sourceName);
    }
}
