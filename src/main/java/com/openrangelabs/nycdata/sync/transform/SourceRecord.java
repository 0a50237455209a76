package com.openrangelabs.nycdata.sync.transform;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDateTime;

/**
 * A source record mapped for local storage.
 *
 * @param naturalKey  dataset-unique key built from the primary key fields
 * @param recordDate  value of the dataset's date field, null if absent
 * @param payload     normalized record body
 */
public record SourceRecord(String naturalKey, LocalDateTime recordDate, ObjectNode payload) {
}
