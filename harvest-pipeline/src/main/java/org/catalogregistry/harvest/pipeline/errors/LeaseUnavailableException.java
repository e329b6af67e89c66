package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * Another pass of the same source held the lease past the wait timeout.
 */
public class LeaseUnavailableException extends HarvestException {
    public LeaseUnavailableException(String message) {
        super(HarvestErrorKind.LEASE_UNAVAILABLE, message);
    }

    public LeaseUnavailableException(String message, Throwable cause) {
        super(HarvestErrorKind.LEASE_UNAVAILABLE, message, cause);
    }
}
