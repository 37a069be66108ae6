package com.di.pgproof.target;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Replica selection and health-check settings ({@code pgproof.replica.*}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "pgproof.replica")
public class ReplicaProperties {

    /** When false, no replica is offered and mutating operations report "unavailable". */
    private boolean enabled = true;

    /** Minimum time between two health probes. */
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    /** Query timeout for the probe statements. */
    private Duration probeTimeout = Duration.ofSeconds(5);

    /**
     * Require {@code pg_is_in_recovery()} to be true. Off by default because the sandbox host is
     * usually a writable copy, not a streaming standby.
     */
    private boolean requireRecoveryMode = false;
}
