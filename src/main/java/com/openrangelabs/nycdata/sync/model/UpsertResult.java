package com.openrangelabs.nycdata.sync.model;

public enum UpsertResult {
    INSERTED,
    UPDATED,
    UNCHANGED;

    public boolean isInsertOrUpdate() {
        return this == INSERTED || this == UPDATED;
    }
}
