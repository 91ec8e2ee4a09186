package com.runwarden.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools and the clock.
 *
 * Each concern gets its own fixed pool so a slow stage execution can never
 * starve polling or webhook handling, and no request thread ever waits on
 * remote work.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Full syncs; at most one per organization is in flight anyway. */
    @Bean(name = "syncExecutor", destroyMethod = "shutdown")
    public ExecutorService syncExecutor(@Value("${runwarden.sync.workers:2}") int workers) {
        return Executors.newFixedThreadPool(workers, named("sync"));
    }

    /** Per-run fetches issued by the poller; bounds concurrent remote calls. */
    @Bean(name = "pollExecutor", destroyMethod = "shutdown")
    public ExecutorService pollExecutor(@Value("${runwarden.poller.workers:4}") int workers) {
        return Executors.newFixedThreadPool(workers, named("poll"));
    }

    /** Pipeline advance loops. Each worker runs one stage at a time. */
    @Bean(name = "validationExecutor", destroyMethod = "shutdown")
    public ExecutorService validationExecutor(@Value("${runwarden.validation.workers:4}") int workers) {
        return Executors.newFixedThreadPool(workers, named("validation"));
    }

    /**
     * Webhook correlation. The queue is bounded and a full queue throws
     * RejectedExecutionException, which the webhook endpoint answers with 503.
     */
    @Bean(name = "webhookExecutor", destroyMethod = "shutdown")
    public ExecutorService webhookExecutor(@Value("${runwarden.webhook.workers:2}") int workers,
                                           @Value("${runwarden.webhook.queue-capacity:1000}") int queueCapacity) {
        return new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), named("webhook"), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
