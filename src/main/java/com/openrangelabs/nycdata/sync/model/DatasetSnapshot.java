package com.openrangelabs.nycdata.sync.model;

import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;

import java.time.LocalDateTime;

/**
 * What the planner knows about one dataset at planning time
 *
 * @param lastSuccessfulSync end time of the latest success or partial run, null if none
 */
public record DatasetSnapshot(DatasetConfig dataset, DataFreshness freshness, LocalDateTime lastSuccessfulSync) {
}
