package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * The persistence store lost connectivity.
 */
public class StoreUnavailableException extends HarvestException {
    public StoreUnavailableException(String message) {
        super(HarvestErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(HarvestErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
