package com.openrangelabs.nycdata.sync.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.RecordTransformException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Citywide rolling sales. Prices arrive as text such as {@code "$1,250,000"};
 * transfers without a positive price are not market sales and are skipped.
 */
@Component
public class PropertySalesTransform extends AbstractRecordTransform {

    static final String DATASET_ID = "usep-8jbt";

    private static final String[] NUMERIC_FIELDS = {
            "sale_price", "land_square_feet", "gross_square_feet",
            "residential_units", "commercial_units", "total_units", "year_built"
    };

    @Override
    public Set<String> supportedDatasets() {
        return Set.of(DATASET_ID);
    }

    @Override
    public Optional<SourceRecord> transform(DatasetConfig dataset, JsonNode raw) {
        ObjectNode payload = asObject(dataset, raw);

        for (String field : NUMERIC_FIELDS) {
            BigDecimal value = parseNumber(payload.get(field), field);
            if (value != null) {
                payload.put(field, value);
            } else {
                payload.remove(field);
            }
        }

        BigDecimal salePrice = payload.has("sale_price") ? payload.get("sale_price").decimalValue() : null;
        if (salePrice == null || salePrice.signum() <= 0) {
            return Optional.empty();
        }

        return Optional.of(new SourceRecord(naturalKey(dataset, payload), recordDate(dataset, payload), payload));
    }

    private BigDecimal parseNumber(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String cleaned = node.asText().replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty() || "-".equals(cleaned)) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new RecordTransformException("Invalid numeric value for " + field + ": " + node.asText(), e);
        }
    }
}
