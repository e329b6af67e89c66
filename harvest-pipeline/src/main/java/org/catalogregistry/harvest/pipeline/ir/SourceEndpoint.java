package org.catalogregistry.harvest.pipeline.ir;

import lombok.Builder;

/**
 * A configured metadata-service endpoint. The name doubles as the identifier
 * namespace for every record harvested from it.
 */
@Builder(toBuilder = true)
public record SourceEndpoint(
    String name,
    String type,
    String location,
    String catalog,
    boolean incremental,
    int pageSize,
    boolean allowPartialListing
) {
    public static final int DEFAULT_PAGE_SIZE = 100;
    /** Namespace of the registry's own records; no harvested source may use it. */
    public static final String RESERVED_NAME = "registry";

    public SourceEndpoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source endpoint name must be provided");
        }
        if (name.contains(":")) {
            throw new IllegalArgumentException("Source endpoint name must not contain ':' - " + name);
        }
        if (catalog == null || catalog.isBlank()) {
            catalog = name;
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    public static boolean isReserved(String name) {
        return name != null && RESERVED_NAME.equalsIgnoreCase(name.trim());
    }

    /** Identifier of a record from this source, unique across all sources. */
    public String identifierFor(String localId) {
        return name + ":" + localId;
    }
}
