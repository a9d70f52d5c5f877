package io.github.samzhu.tracehub.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

class ObservabilityConfigTest {

    private final TaskDecorator decorator = new ObservabilityConfig().contextPropagatingTaskDecorator();

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void executionKeysReachWorkerThread() throws Exception {
        MDC.put("executionId", "trace-1");
        MDC.put("spanId", "span-1");
        AtomicReference<String> seenExecution = new AtomicReference<>();
        AtomicReference<String> seenSpan = new AtomicReference<>();
        Runnable task = decorator.decorate(() -> {
            seenExecution.set(MDC.get("executionId"));
            seenSpan.set(MDC.get("spanId"));
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(task).get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(seenExecution.get()).isEqualTo("trace-1");
        assertThat(seenSpan.get()).isEqualTo("span-1");
    }

    @Test
    void workerValuesAreRestoredAfterTask() {
        MDC.put("executionId", "submitted");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable task = decorator.decorate(() -> seen.set(MDC.get("executionId")));

        MDC.put("executionId", "worker");
        task.run();

        assertThat(seen.get()).isEqualTo("submitted");
        assertThat(MDC.get("executionId")).isEqualTo("worker");
    }
}
