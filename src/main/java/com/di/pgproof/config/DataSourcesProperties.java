package com.di.pgproof.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for every database the service talks to.
 *
 * <pre>
 * pgproof:
 *   datasources:
 *     primary:  { jdbc-url: ..., username: ..., password: ... }
 *     replica:  { jdbc-url: ..., maximum-pool-size: 5 }
 *     metadata: { jdbc-url: ... }   # job/audit/applied-change tables
 * </pre>
 *
 * <p>An empty {@code jdbc-url} means "not configured". Mutating work is only ever routed to
 * the replica side; the primary is used for reads and nothing else. Sandbox
 * namespaces live on the replica.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pgproof.datasources")
public class DataSourcesProperties {

    private Connection primary = new Connection();
    private Connection replica = new Connection();
    private Connection metadata = new Connection();

    @Data
    public static class Connection {
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        private int maximumPoolSize = 5;
        private int minimumIdle = 1;
        private Duration idleTimeout = Duration.ofMinutes(10);
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration maxLifetime = Duration.ofMinutes(30);

        public boolean isConfigured() {
            return jdbcUrl != null && !jdbcUrl.isBlank();
        }

        public DbConfigSnapshot toSnapshot(String role) {
            return new DbConfigSnapshot(role, jdbcUrl, username, password, driverClassName,
                    maximumPoolSize, minimumIdle, idleTimeout.toMillis(), connectionTimeout.toMillis(),
                    maxLifetime.toMillis());
        }
    }
}
