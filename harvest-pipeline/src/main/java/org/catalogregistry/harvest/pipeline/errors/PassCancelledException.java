package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * Raised at the next record boundary after a pass was cancelled.
 */
public class PassCancelledException extends HarvestException {
    public PassCancelledException(String message) {
        super(HarvestErrorKind.CANCELLED, message);
    }

    public PassCancelledException(String message, Throwable cause) {
        super(HarvestErrorKind.CANCELLED, message, cause);
    }
}
