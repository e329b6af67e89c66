package org.catalogregistry.harvest.pipeline.ir;

/**
 * A catalog record as delivered by a source, before normalization.
 *
 * @param localId the source-local identifier when the reader could extract one, otherwise null
 * @param payload the record body as a JSON object text
 */
public record RawRecord(
    String localId,
    String payload
) {
    /** Reference used in failure reports when the record cannot be identified. */
    public String reference(int position) {
        return localId != null ? localId : "#" + position;
    }
}
