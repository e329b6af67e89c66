package org.catalogregistry.harvest.pipeline.ir;

public enum PassOutcome {
    COMPLETED,
    FAILED
}
