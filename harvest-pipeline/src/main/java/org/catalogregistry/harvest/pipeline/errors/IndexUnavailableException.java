package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * The search index could not be reached, or kept failing after retries.
 */
public class IndexUnavailableException extends HarvestException {
    public IndexUnavailableException(String message) {
        super(HarvestErrorKind.INDEX_UNAVAILABLE, message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(HarvestErrorKind.INDEX_UNAVAILABLE, message, cause);
    }
}
