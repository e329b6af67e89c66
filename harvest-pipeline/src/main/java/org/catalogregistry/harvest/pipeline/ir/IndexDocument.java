package org.catalogregistry.harvest.pipeline.ir;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Disposable projection of a live canonical record into a search index.
 * The id always equals the record identifier.
 */
public record IndexDocument(
    String id,
    String index,
    ObjectNode body
) {}
