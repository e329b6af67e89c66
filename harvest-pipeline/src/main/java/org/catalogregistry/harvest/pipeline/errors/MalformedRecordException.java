package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * A raw record without an identifier or with a payload that is not a JSON object.
 */
public class MalformedRecordException extends HarvestException {
    public MalformedRecordException(String message) {
        super(HarvestErrorKind.MALFORMED_RECORD, message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(HarvestErrorKind.MALFORMED_RECORD, message, cause);
    }
}
