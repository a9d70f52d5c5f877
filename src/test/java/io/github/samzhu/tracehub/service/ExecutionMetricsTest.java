package io.github.samzhu.tracehub.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ExecutionMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ExecutionMetrics metrics = new ExecutionMetrics(registry);

    @Test
    void totalsAreReadFromCounters() {
        metrics.recordCompleted(true);
        metrics.recordCompleted(true);
        metrics.recordCompleted(false);

        assertThat(metrics.getCompletedCount()).isEqualTo(3);
        assertThat(metrics.getViolationCount()).isEqualTo(1);
        assertThat(registry.get("execution.graphs").tag("outcome", "valid").counter().count()).isEqualTo(2.0);
    }

    @Test
    void rejectionsAreSummedAcrossCodes() {
        metrics.recordRejection("MISSING_EXECUTION_CONTEXT");
        metrics.recordRejection("MISSING_EXECUTION_CONTEXT");
        metrics.recordRejection("INVALID_EXECUTION_CONTEXT");

        assertThat(metrics.getRejectionCount()).isEqualTo(3);
        assertThat(registry.get("execution.context.rejections").tag("code", "INVALID_EXECUTION_CONTEXT")
            .counter().count()).isEqualTo(1.0);
    }
}
