package com.relationalizer.model;

/**
 * SQLite storage classes used for generated columns.
 */
public enum SqlType {
    INTEGER,
    REAL,
    TEXT
}
