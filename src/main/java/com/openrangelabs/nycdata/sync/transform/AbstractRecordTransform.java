package com.openrangelabs.nycdata.sync.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.RecordTransformException;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Key and date extraction shared by transforms
 */
public abstract class AbstractRecordTransform implements RecordTransform {

    protected static final String KEY_SEPARATOR = "|";

    protected String naturalKey(DatasetConfig dataset, JsonNode raw) {
        List<String> keyFields = dataset.getPrimaryKeyFieldList();
        if (keyFields.isEmpty()) {
            throw new RecordTransformException("No primary key fields configured for " + dataset.getDatasetId());
        }
        StringBuilder key = new StringBuilder();
        for (String field : keyFields) {
            JsonNode value = raw.get(field);
            if (value == null || value.isNull() || value.asText().isBlank()) {
                throw new RecordTransformException("Missing key field '" + field + "' in " + dataset.getDatasetId());
            }
            if (key.length() > 0) {
                key.append(KEY_SEPARATOR);
            }
            key.append(value.asText().trim());
        }
        return key.toString();
    }

    protected LocalDateTime recordDate(DatasetConfig dataset, JsonNode raw) {
        if (!dataset.supportsIncrementalSync()) {
            return null;
        }
        return RecordDates.parse(raw.path(dataset.getDateField()).asText(null), dataset.getDateFormat());
    }

    protected ObjectNode asObject(DatasetConfig dataset, JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new RecordTransformException("Record of " + dataset.getDatasetId() + " is not a JSON object");
        }
        return ((ObjectNode) raw).deepCopy();
    }
}
