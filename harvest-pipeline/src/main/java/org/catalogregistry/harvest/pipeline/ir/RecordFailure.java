package org.catalogregistry.harvest.pipeline.ir;

/**
 * A record-scoped failure attributed to a single record of a pass.
 *
 * @param reference the record identifier, or the source-local id or listing position when unknown
 */
public record RecordFailure(
    String reference,
    HarvestErrorKind kind,
    String message
) {}
