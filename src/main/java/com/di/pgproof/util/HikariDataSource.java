package com.di.pgproof.util;

import com.di.pgproof.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide cache of HikariCP pools keyed by JDBC URL + username, so primary, replica and
 * metadata connections each get exactly one pool no matter how many components ask for it.
 *
 * <p>Pools are created with auto-commit on. Callers that need a transaction switch it off for the
 * duration of their operation and restore it before returning the connection.
 */
@Slf4j
public enum HikariDataSource {

    INSTANCE;

    private final ConcurrentMap<String, com.zaxxer.hikari.HikariDataSource> dataSourceCache = new ConcurrentHashMap<>();

    /** Stable, positive pool ids for monitoring. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    /** Fraction of free server connections to use when fewer are free than configured. */
    private static final double CONNECTION_LIMIT_SAFETY_RATIO = 0.6;

    /**
     * Gets or creates the pool for the given configuration.
     *
     * @param snapshot connection settings
     * @return shared pool for {@code jdbcUrl + username}
     */
    public DataSource getOrInit(DbConfigSnapshot snapshot) {
        String connectionKey = generateConnectionKey(snapshot);

        return dataSourceCache.computeIfAbsent(connectionKey, key -> {
            int configMaxPool = snapshot.maximumPoolSize();
            int effectivePoolSize = validateAndResolvePoolSize(snapshot, configMaxPool);
            int effectiveMinIdle = Math.min(snapshot.minimumIdle(), effectivePoolSize);

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            hikariConfig.setDriverClassName(snapshot.driverClassName());
            hikariConfig.setMaximumPoolSize(effectivePoolSize);
            hikariConfig.setMinimumIdle(effectiveMinIdle);
            hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
            hikariConfig.setAutoCommit(true);
            // Do not fail startup when a replica is down; health checks report it instead.
            hikariConfig.setInitializationFailTimeout(-1);
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            hikariConfig.addDataSourceProperty("ApplicationName", "pgproof-" + snapshot.role());
            hikariConfig.setPoolName("HikariPool-" + poolIdCounter.incrementAndGet() + "-" + generateShortPoolKey(snapshot));

            log.info("[POOL] Creating | role={} | url={} | user={} | config maxPoolSize={} | effective maxPoolSize={}, minIdle={}",
                    snapshot.role(), sanitizeUrl(snapshot.jdbcUrl()), snapshot.username(), configMaxPool,
                    effectivePoolSize, effectiveMinIdle);
            return new com.zaxxer.hikari.HikariDataSource(hikariConfig);
        });
    }

    private String generateConnectionKey(DbConfigSnapshot snapshot) {
        return snapshot.jdbcUrl() + "|" + snapshot.username();
    }

    /**
     * Short pool key: role, host, database and user, no password.
     */
    private String generateShortPoolKey(DbConfigSnapshot snapshot) {
        String url = snapshot.jdbcUrl();
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        String role = snapshot.role() != null ? snapshot.role() : "db";
        if (url == null || url.isBlank()) {
            return (role + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_");
        }
        String part = sanitizeUrl(url);
        int slashSlash = part.indexOf("//");
        if (slashSlash >= 0) {
            part = part.substring(slashSlash + 2);
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (role + "_" + host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    /**
     * Masks passwords embedded in a JDBC URL.
     */
    public static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }

    /**
     * Closes and removes one pool, e.g. before re-initialising a replica that stopped answering.
     */
    public void closeDataSource(DbConfigSnapshot snapshot) {
        String connectionKey = generateConnectionKey(snapshot);
        com.zaxxer.hikari.HikariDataSource dataSource = dataSourceCache.remove(connectionKey);
        if (dataSource != null) {
            try {
                dataSource.close();
                log.info("[POOL] Closed pool {} for {}", dataSource.getPoolName(), sanitizeUrl(snapshot.jdbcUrl()));
            } catch (Exception e) {
                log.warn("[POOL] Error closing pool for {}", sanitizeUrl(snapshot.jdbcUrl()), e);
            }
        }
    }

    /**
     * Closes every pool and clears the cache. Called on application shutdown.
     */
    public void closeAll() {
        log.info("[POOL] Closing all pools (count: {})", dataSourceCache.size());
        dataSourceCache.forEach((key, dataSource) -> {
            try {
                dataSource.close();
            } catch (Exception e) {
                log.warn("[POOL] Error closing pool {}", dataSource.getPoolName(), e);
            }
        });
        dataSourceCache.clear();
    }

    public int getActiveConnectionCount() {
        return dataSourceCache.size();
    }

    /**
     * Checks free server connections before building the pool. If fewer are free than configured,
     * uses 60% of what is free so that benchmark pools do not starve the replica.
     */
    private int validateAndResolvePoolSize(DbConfigSnapshot snapshot, int configMaxPool) {
        if (configMaxPool <= 0) return configMaxPool;
        try {
            Class.forName(snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()
                    ? snapshot.driverClassName() : "org.postgresql.Driver");
            try (Connection conn = DriverManager.getConnection(
                    snapshot.jdbcUrl(), snapshot.username(), snapshot.password())) {
                int available = queryAvailableConnections(conn);
                if (available <= 0) {
                    log.warn("[POOL] Validation | Could not query free connections | using config maxPoolSize={}", configMaxPool);
                    return configMaxPool;
                }
                if (available < configMaxPool) {
                    int effective = Math.max(1, (int) Math.floor(available * CONNECTION_LIMIT_SAFETY_RATIO));
                    log.info("[POOL] Validation | free connections ({}) < config maxPoolSize ({}) | using 60% of available = {}",
                            available, configMaxPool, effective);
                    return effective;
                }
                return configMaxPool;
            }
        } catch (Exception e) {
            log.warn("[POOL] Validation | Unable to connect for availability check | url={} | user={} | error={} | using config maxPoolSize={}",
                    sanitizeUrl(snapshot.jdbcUrl()), snapshot.username(), e.getMessage(), configMaxPool);
            return configMaxPool;
        }
    }

    private int queryAvailableConnections(Connection conn) {
        int maxConn = -1;
        int current = -1;
        try (Statement st = conn.createStatement()) {
            try (ResultSet rs = st.executeQuery("SHOW max_connections")) {
                if (rs.next()) maxConn = Integer.parseInt(rs.getString(1).trim());
            }
            try (ResultSet rs = st.executeQuery("SELECT count(*) FROM pg_stat_activity")) {
                if (rs.next()) current = rs.getInt(1);
            }
        } catch (Exception e) {
            log.warn("[POOL] Validation | Error querying free connections | error={}", e.getMessage());
            return -1;
        }
        if (maxConn > 0 && current >= 0) {
            return Math.max(0, maxConn - current);
        }
        return -1;
    }
}
