package com.di.pgproof.maintenance;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic cleanup ({@code pgproof.maintenance.*}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "pgproof.maintenance")
public class MaintenanceProperties {

    private boolean enabled = true;

    /** Delay between the end of one run and the start of the next. */
    private Duration interval = Duration.ofMinutes(15);

    private Duration applySandboxMaxAge = Duration.ofHours(24);

    private Duration jobRetention = Duration.ofHours(24);
}
