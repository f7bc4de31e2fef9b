package com.challenges.stagedb.storage;

/**
 * Raised by the row store when a request names a missing table or column, or when a
 * mutation would break a NOT NULL or PRIMARY KEY constraint. Nothing is changed when
 * it is thrown.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public static StoreException forTableNotFound(String table) {
        return new StoreException("Table '" + table + "' does not exist");
    }

    public static StoreException forTableExists(String table) {
        return new StoreException("Table '" + table + "' already exists");
    }

    public static StoreException forColumnNotFound(String column, String table) {
        return new StoreException("Column '" + column + "' does not exist in table '" + table + "'");
    }
}
