package com.openrangelabs.nycdata.sync.model;

import java.util.List;

/**
 * Outcome of writing one batch of records
 */
public record BatchWriteResult(int inserted, int updated, int unchanged) {

    public static BatchWriteResult empty() {
        return new BatchWriteResult(0, 0, 0);
    }

    public static BatchWriteResult of(List<UpsertResult> results) {
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (UpsertResult result : results) {
            switch (result) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new BatchWriteResult(inserted, updated, unchanged);
    }

    public int total() {
        return inserted + updated + unchanged;
    }
}
