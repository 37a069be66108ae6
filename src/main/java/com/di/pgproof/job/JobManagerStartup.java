package com.di.pgproof.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the job manager after the datasources have been checked (order 1).
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class JobManagerStartup implements ApplicationRunner {

    private final JobManager jobManager;
    private final JobProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isAutoStart()) {
            log.info("[JOB] pgproof.jobs.auto-start=false; job manager not started");
            return;
        }
        jobManager.start();
    }
}
