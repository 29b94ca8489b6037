package com.tessera.database.adapter;

/** Column defaults that are expressions rather than literal values. */
public enum DefaultExpression {
    CURRENT_TIMESTAMP
}
