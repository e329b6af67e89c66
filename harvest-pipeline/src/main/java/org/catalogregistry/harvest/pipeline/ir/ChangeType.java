package org.catalogregistry.harvest.pipeline.ir;

public enum ChangeType {
    CREATED,
    UPDATED,
    UNCHANGED,
    DELETED
}
