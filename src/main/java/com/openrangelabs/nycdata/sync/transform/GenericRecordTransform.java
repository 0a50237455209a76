package com.openrangelabs.nycdata.sync.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default transform: keeps the record as delivered, minus Socrata computed
 * region columns (prefixed {@code :@computed_region}).
 */
@Component
public class GenericRecordTransform extends AbstractRecordTransform {

    @Override
    public Set<String> supportedDatasets() {
        return Set.of();
    }

    @Override
    public Optional<SourceRecord> transform(DatasetConfig dataset, JsonNode raw) {
        ObjectNode payload = asObject(dataset, raw);
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            if (fields.next().getKey().startsWith(":@computed_region")) {
                fields.remove();
            }
        }
        return Optional.of(new SourceRecord(naturalKey(dataset, payload), recordDate(dataset, payload), payload));
    }
}
