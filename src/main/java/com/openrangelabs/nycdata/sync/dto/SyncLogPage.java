package com.openrangelabs.nycdata.sync.dto;

import com.openrangelabs.nycdata.sync.entity.SyncLog;

import java.util.List;

public record SyncLogPage(
        List<SyncLog> logs,
        long total,
        int limit,
        int offset,
        List<SyncLogStats> stats) {

    public boolean hasMore() {
        return offset + logs.size() < total;
    }
}
