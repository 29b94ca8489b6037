package com.tessera.database.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Populates a database with data. Start a seeder with {@link #seed(Database)}. */
public abstract class Seeder {

    private static final Logger log = LoggerFactory.getLogger(Seeder.class);

    private Database database;

    public abstract void run(Database database);

    public final void seed(Database database) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.database = database;
        log.info("Seeding: {}", getClass().getSimpleName());
        run(database);
    }

    /** Runs other seeders against the database this seeder runs on. */
    protected void call(Seeder... seeders) {
        if (database == null) {
            throw new IllegalStateException("call() is only available while the seeder runs");
        }
        for (Seeder seeder : seeders) {
            seeder.seed(database);
        }
    }
}
