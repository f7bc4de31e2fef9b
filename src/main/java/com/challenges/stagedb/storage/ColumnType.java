package com.challenges.stagedb.storage;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared column types. The engine stores values as parsed from literals; the type is
 * kept for schema display and persistence only.
 */
public enum ColumnType {
    INTEGER,
    TEXT,
    REAL,
    BLOB;

    public static Optional<ColumnType> fromKeyword(String keyword) {
        String upper = keyword.toUpperCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.name().equals(upper)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
