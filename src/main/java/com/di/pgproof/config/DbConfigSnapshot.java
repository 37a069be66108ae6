package com.di.pgproof.config;

import java.io.Serializable;

/**
 * Immutable connection settings for one pool. {@code role} is the logical name
 * (primary, replica, metadata) and only feeds the pool name.
 */
public record DbConfigSnapshot(String role, String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {

    public boolean isConfigured() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }

    @Override
    public String toString() {
        return "DbConfigSnapshot[role=" + role + ", jdbcUrl=" + jdbcUrl + ", username=" + username
                + ", password=***, maximumPoolSize=" + maximumPoolSize + "]";
    }
}
