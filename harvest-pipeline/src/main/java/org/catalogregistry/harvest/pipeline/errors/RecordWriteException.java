package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * A single-record store write that failed while the store itself stayed reachable.
 */
public class RecordWriteException extends HarvestException {
    public RecordWriteException(String message) {
        super(HarvestErrorKind.RECORD_WRITE, message);
    }

    public RecordWriteException(String message, Throwable cause) {
        super(HarvestErrorKind.RECORD_WRITE, message, cause);
    }
}
