package com.di.pgproof.config;

import com.di.pgproof.util.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;

@Slf4j
@Configuration
public class PgProofConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Metadata stores (jobs, audit, applied changes, recommendations) only exist when persistence is on.
     */
    @Configuration
    @ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "true")
    static class MetadataStoreConfiguration {

        @Bean
        public DataSource metadataDataSource(DataSourcesProperties dataSources) {
            DataSourcesProperties.Connection metadata = dataSources.getMetadata();
            if (!metadata.isConfigured()) {
                throw new IllegalStateException(
                        "pgproof.store.persistence-enabled=true requires pgproof.datasources.metadata.jdbc-url");
            }
            log.info("[DS-STARTUP] Metadata store on {}", HikariDataSource.sanitizeUrl(metadata.getJdbcUrl()));
            return HikariDataSource.INSTANCE.getOrInit(metadata.toSnapshot("metadata"));
        }

        @Bean
        public JdbcTemplate jdbcTemplate(DataSource metadataDataSource) {
            return new JdbcTemplate(metadataDataSource);
        }
    }
}
