package com.di.pgproof.apply;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Apply/rollback settings ({@code pgproof.apply.*}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "pgproof.apply")
public class ApplyProperties {

    /** Apply namespaces older than this are dropped by cleanup. */
    private Duration sandboxMaxAge = Duration.ofHours(24);

    /** Run the apply-namespace cleanup once more when the service shuts down. */
    private boolean reapOnShutdown = true;

    private int auditTrailMaxLimit = 1000;
}
