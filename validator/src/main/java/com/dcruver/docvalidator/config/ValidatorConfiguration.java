package com.dcruver.docvalidator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for per-document validation (phase 1).
 */
@Configuration
@Slf4j
public class ValidatorConfiguration {

    @Bean(name = "documentValidationExecutor")
    public ThreadPoolTaskExecutor documentValidationExecutor(ValidatorProperties properties) {
        int threads = Math.max(1, properties.getParallelism());
        log.debug("Creating document validation pool with {} threads", threads);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("doc-validate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
