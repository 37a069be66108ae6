package com.di.pgproof.target;

import com.di.pgproof.config.DbConfigSnapshot;

import javax.sql.DataSource;

/**
 * Source of shared connection pools.
 */
public interface ConnectionPoolFactory {

    DataSource getOrCreate(DbConfigSnapshot snapshot);

    /** Closes and forgets the pool so the next {@link #getOrCreate} builds a fresh one. */
    void evict(DbConfigSnapshot snapshot);
}
