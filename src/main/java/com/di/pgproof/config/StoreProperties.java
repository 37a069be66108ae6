package com.di.pgproof.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where jobs, audit entries and applied changes are kept ({@code pgproof.store.*}).
 * With persistence disabled every store is in-memory and nothing survives a restart.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pgproof.store")
public class StoreProperties {

    /** true: JDBC stores on {@code pgproof.datasources.metadata}; false: in-memory stores. */
    private boolean persistenceEnabled = false;

    /** Run {@link #schemaLocation} against the metadata database at startup. */
    private boolean initializeSchema = true;

    private String schemaLocation = "classpath:db/pgproof-schema.sql";
}
