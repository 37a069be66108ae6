package com.di.pgproof.config;

import com.di.pgproof.target.ReplicaManager;
import com.di.pgproof.target.ReplicaStatus;
import com.di.pgproof.util.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * At startup, logs which databases are configured, creates the metadata tables when persistence is
 * on, and probes the replica once so the first benchmark does not pay for pool creation.
 * Failures are logged; the service still starts and reports benchmarking as unavailable.
 */
@Slf4j
@Component
@Order(1)
public class DataSourceStartupInitializer implements ApplicationRunner {

    private final DataSourcesProperties dataSources;
    private final StoreProperties storeProperties;
    private final ReplicaManager replicaManager;
    private final ObjectProvider<DataSource> metadataDataSource;
    private final ResourceLoader resourceLoader;

    public DataSourceStartupInitializer(DataSourcesProperties dataSources, StoreProperties storeProperties,
                                        ReplicaManager replicaManager, ObjectProvider<DataSource> metadataDataSource,
                                        ResourceLoader resourceLoader) {
        this.dataSources = dataSources;
        this.storeProperties = storeProperties;
        this.replicaManager = replicaManager;
        this.metadataDataSource = metadataDataSource;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public void run(ApplicationArguments args) {
        logConnection("primary", dataSources.getPrimary());
        logConnection("replica", dataSources.getReplica());
        logConnection("metadata", dataSources.getMetadata());

        if (storeProperties.isPersistenceEnabled() && storeProperties.isInitializeSchema()) {
            initializeSchema();
        } else if (!storeProperties.isPersistenceEnabled()) {
            log.info("[DS-STARTUP] pgproof.store.persistence-enabled=false; jobs, audit and applied changes are kept in memory");
        }

        try {
            boolean healthy = replicaManager.isHealthy();
            ReplicaStatus status = replicaManager.status();
            if (!status.isConfigured()) {
                log.warn("[DS-STARTUP] No replica configured; benchmark and apply jobs will end in error");
            } else {
                log.info("[DS-STARTUP] Replica healthy={}", healthy);
            }
        } catch (RuntimeException e) {
            log.error("[DS-STARTUP] Replica probe failed: {}", e.getMessage());
        }
    }

    private void initializeSchema() {
        DataSource ds = metadataDataSource.getIfAvailable();
        if (ds == null) {
            log.warn("[DS-STARTUP] Persistence enabled but no metadata datasource; skipping schema initialization");
            return;
        }
        try {
            ResourceDatabasePopulator populator =
                    new ResourceDatabasePopulator(resourceLoader.getResource(storeProperties.getSchemaLocation()));
            populator.setContinueOnError(false);
            DatabasePopulatorUtils.execute(populator, ds);
            log.info("[DS-STARTUP] Metadata schema initialized from {}", storeProperties.getSchemaLocation());
        } catch (RuntimeException e) {
            log.error("[DS-STARTUP] Metadata schema initialization failed: {}", e.getMessage());
        }
    }

    private static void logConnection(String role, DataSourcesProperties.Connection connection) {
        if (connection.isConfigured()) {
            log.info("[DS-STARTUP] {}: {} (max pool {})", role,
                    HikariDataSource.sanitizeUrl(connection.getJdbcUrl()), connection.getMaximumPoolSize());
        } else {
            log.info("[DS-STARTUP] {}: not configured", role);
        }
    }
}
