package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

/**
 * The source endpoint could not be enumerated.
 */
public class SourceUnreachableException extends HarvestException {
    public SourceUnreachableException(String message) {
        super(HarvestErrorKind.SOURCE_UNREACHABLE, message);
    }

    public SourceUnreachableException(String message, Throwable cause) {
        super(HarvestErrorKind.SOURCE_UNREACHABLE, message, cause);
    }
}
