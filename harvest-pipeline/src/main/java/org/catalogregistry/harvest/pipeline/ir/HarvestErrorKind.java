package org.catalogregistry.harvest.pipeline.ir;

public enum HarvestErrorKind {
    MALFORMED_RECORD(false),
    RECORD_WRITE(false),
    INDEX_DOCUMENT(false),
    SOURCE_UNREACHABLE(true),
    STORE_UNAVAILABLE(true),
    INDEX_UNAVAILABLE(true),
    LEASE_UNAVAILABLE(true),
    CANCELLED(true),
    INTERNAL(true);

    private final boolean passScoped;

    HarvestErrorKind(boolean passScoped) {
        this.passScoped = passScoped;
    }

    /** Pass-scoped errors abort the pass of the affected source; the others only skip a record. */
    public boolean isPassScoped() {
        return passScoped;
    }
}
