package com.tessera.database.config;

/**
 * Connection pool bounds handed to the adapter's pool implementation.
 *
 * @param min minimum idle connections
 * @param max maximum pool size
 */
public record PoolConfig(int min, int max) {

    public static final int DEFAULT_MIN = 0;
    public static final int DEFAULT_MAX = 10;

    public PoolConfig {
        if (min < 0) {
            throw new IllegalArgumentException("pool.min must be >= 0");
        }
        if (max < 1) {
            throw new IllegalArgumentException("pool.max must be >= 1");
        }
        if (min > max) {
            throw new IllegalArgumentException("pool.min must not exceed pool.max");
        }
    }

    public static PoolConfig defaults() {
        return new PoolConfig(DEFAULT_MIN, DEFAULT_MAX);
    }
}
