package com.di.pgproof.job;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Job queue and worker pool settings ({@code pgproof.jobs.*}).
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "pgproof.jobs")
public class JobProperties {

    /** Worker threads; at most this many jobs run at once. */
    @Min(1)
    private int maxConcurrency = 3;

    /** Bounded queue size; submissions beyond it wait in an overflow list. */
    @Min(1)
    private int queueCapacity = 100;

    private Duration pollTimeout = Duration.ofSeconds(1);

    /** Pause after an unexpected failure in the dispatch loop. */
    private Duration loopBackoff = Duration.ofSeconds(1);

    /** How long cancel() and stop() wait for a running job to finish its cleanup. */
    private Duration cancelAwaitTimeout = Duration.ofSeconds(10);

    /** Fraction of each table copied into a benchmark sandbox, in percent. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private double samplePercent = 10.0;

    private boolean autoStart = true;

    /** On start, fail jobs left RUNNING by a previous process and re-enqueue PENDING ones. */
    private boolean recoverOnStart = true;

    @Min(1)
    private int maxListLimit = 1000;
}
