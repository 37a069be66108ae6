package com.di.pgproof;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sandboxed benchmark and safe-apply service. Pools are built from {@code pgproof.datasources.*}
 * rather than Spring's single auto-configured datasource.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
@EnableScheduling
public class PgProofApplication {

	public static void main(String[] args) {
		SpringApplication.run(PgProofApplication.class, args);
	}
}
