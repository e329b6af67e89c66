package org.catalogregistry.harvest.pipeline.errors;

import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;

import lombok.Getter;

/**
 * Base of all harvest failures. The kind decides whether the failure is
 * confined to a record or aborts the pass of its source.
 */
@Getter
public abstract class HarvestException extends Exception {
    private final HarvestErrorKind kind;

    protected HarvestException(HarvestErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected HarvestException(HarvestErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isPassScoped() {
        return kind.isPassScoped();
    }
}
