package com.openrangelabs.nycdata.sync.model;

/**
 * A column of a catalog dataset. {@code dataType} is one of text, number, date or boolean.
 */
public record DatasetColumn(
        String fieldName,
        String displayName,
        String dataType,
        String description,
        int position) {

    public boolean isDate() {
        return "date".equals(dataType);
    }
}
