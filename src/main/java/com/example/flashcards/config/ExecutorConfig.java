package com.example.flashcards.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for unit operations.
 *
 * Threads are cheap to keep around compared to the remote calls they make; the
 * actual number of concurrent calls is bounded per run by the ConcurrencyLimiter.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.thread-name-prefix:unit-worker-}")
    private String threadNamePrefix = "unit-worker-";

    @Bean(name = "unitWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService unitWorkerExecutor() {
        log.info("Creating unit worker executor with MDC propagation (prefix={})", threadNamePrefix);
        return new MdcPropagatingExecutorService(Executors.newCachedThreadPool(namedDaemonThreads(threadNamePrefix)));
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
