package com.tessera.database.adapter;

/** Aggregates the adapters can compute server-side. */
public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX
}
