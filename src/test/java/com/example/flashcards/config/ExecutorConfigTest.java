package com.example.flashcards.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    @Autowired
    @Qualifier("unitWorkerExecutor")
    private ExecutorService unitWorkerExecutor;

    private static final String RUN_ID = "runId";

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void shouldPropagateRunIdToAsyncDispatch() throws Exception {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        String seen = CompletableFuture.supplyAsync(() -> MDC.get(RUN_ID), unitWorkerExecutor)
                .get(5, TimeUnit.SECONDS);
        MDC.remove(RUN_ID);

        assertThat(seen).isEqualTo(runId);
        assertThat(MDC.get(RUN_ID)).isNull();
    }

    @Test
    void shouldPropagateRunIdWithSubmit() throws Exception {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        Future<String> future = unitWorkerExecutor.submit(() -> MDC.get(RUN_ID));

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(runId);
    }

    @Test
    void shouldPropagateRunIdWithInvokeAll() throws Exception {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        List<Callable<String>> tasks = IntStream.range(0, 5)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(RUN_ID))
                .toList();

        List<Future<String>> futures = unitWorkerExecutor.invokeAll(tasks, 5, TimeUnit.SECONDS);

        for (Future<String> future : futures) {
            assertThat(future.get()).isEqualTo(runId);
        }
    }

    @Test
    void shouldNotLeakRunIdIntoLaterTasks() throws Exception {
        MDC.put(RUN_ID, "first-run");
        unitWorkerExecutor.submit(() -> MDC.get(RUN_ID)).get(5, TimeUnit.SECONDS);
        MDC.clear();

        // the same pooled thread is likely reused; it must start without the old run's context
        String leaked = unitWorkerExecutor.submit(() -> MDC.get(RUN_ID)).get(5, TimeUnit.SECONDS);

        assertThat(leaked).isNull();
    }

    @Test
    void shouldPropagateRunIdWithInvokeAny() throws Exception {
        final String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);

        List<Callable<String>> tasks = IntStream.range(0, 3)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(RUN_ID))
                .toList();

        assertThat(unitWorkerExecutor.invokeAny(tasks, 5, TimeUnit.SECONDS)).isEqualTo(runId);
    }

    @Test
    void shouldRunWithoutContextWhenSubmitterHasNone() throws Exception {
        String seen = unitWorkerExecutor.submit(() -> MDC.get(RUN_ID)).get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }

    @Test
    void shouldNameWorkerThreadsAsDaemons() throws Exception {
        Thread worker = unitWorkerExecutor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("unit-worker-");
        assertThat(worker.isDaemon()).isTrue();
    }
}
