package com.cusip.refdata.load.model;

import java.util.Locale;

public record ColumnSpec(
    String name,
    ColumnType type,
    int precision,
    int scale
) {
    public static ColumnSpec text(String name) {
        return new ColumnSpec(name, ColumnType.TEXT, 0, 0);
    }

    public static ColumnSpec date(String name) {
        return new ColumnSpec(name, ColumnType.DATE, 0, 0);
    }

    public static ColumnSpec integer(String name) {
        return new ColumnSpec(name, ColumnType.INTEGER, 0, 0);
    }

    public static ColumnSpec decimal(String name, int precision, int scale) {
        return new ColumnSpec(name, ColumnType.DECIMAL, precision, scale);
    }

    /**
     * SQL expression that converts the raw staged text of this column to its master type.
     */
    public String castExpression(String alias) {
        String ref = alias + "." + name;
        return switch (type) {
            case TEXT -> ref;
            case DATE -> "CAST(" + ref + " AS DATE)";
            case INTEGER -> "CAST(" + ref + " AS INTEGER)";
            case DECIMAL -> String.format(Locale.ROOT, "CAST(%s AS DECIMAL(%d,%d))", ref, precision, scale);
        };
    }

    public enum ColumnType {
        TEXT,
        DATE,
        INTEGER,
        DECIMAL
    }
}
