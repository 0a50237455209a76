package com.openrangelabs.nycdata.sync.dto;

import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.entity.SyncLog;

/**
 * A dataset with its freshness record and latest completed run
 */
public record DatasetDetails(DatasetConfig config, DataFreshness freshness, SyncLog lastCompletedSync) {
}
