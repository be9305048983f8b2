package com.cusip.refdata.load.model;

import java.util.Collections;
import java.util.List;

/**
 * One data line of a PIP file. Values are positional, trimmed, and null where the field was blank.
 */
public record ParsedRow(
    long lineNumber,
    List<String> values
) {
    public ParsedRow {
        values = Collections.unmodifiableList(values);
    }

    public String value(RecordType type, String column) {
        int index = type.columnNames().indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column " + column + " for " + type.apiName());
        }
        return values.get(index);
    }
}
