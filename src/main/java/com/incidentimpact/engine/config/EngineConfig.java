package com.incidentimpact.engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure for the evaluation pipeline.
 *
 * The route worker pool is fixed-size so a batch with many routes can never fan out
 * more threads than configured; a request with fewer routes than workers simply uses
 * fewer of them.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Value("${incident-impact.batch.pool-size:0}")
    private int poolSize;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService routeEvaluationExecutor() {
        int threads = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "route-eval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Route evaluation pool sized at {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
