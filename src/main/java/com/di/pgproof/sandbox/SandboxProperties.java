package com.di.pgproof.sandbox;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sandbox settings ({@code pgproof.sandbox.*}).
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "pgproof.sandbox")
public class SandboxProperties {

    /** Schema that unqualified recommendation table names refer to. */
    @NotBlank
    private String sourceSchema = "public";

    /** Per-statement timeout for measured queries; zero disables it. */
    private Duration statementTimeout = Duration.ofMinutes(5);
}
