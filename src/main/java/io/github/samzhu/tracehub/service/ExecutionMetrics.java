package io.github.samzhu.tracehub.service;

import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 執行追蹤指標
 *
 * <p>Micrometer 計數器：
 * <ul>
 *   <li>{@code execution.context.rejections{code}} - 被拒絕的請求（400）</li>
 *   <li>{@code execution.graphs{outcome=valid|invariant_violation}} - 完成的 execution graph</li>
 * </ul>
 *
 * <p>累計值直接讀取計數器，供健康檢查顯示。
 *
 * @see io.github.samzhu.tracehub.health.ExecutionHealthIndicator
 */
@Service
public class ExecutionMetrics {

    private static final String REJECTIONS = "execution.context.rejections";

    private final MeterRegistry registry;
    private final Counter validGraphs;
    private final Counter violatedGraphs;

    public ExecutionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.validGraphs = Counter.builder("execution.graphs")
            .description("Completed execution graphs")
            .tag("outcome", "valid")
            .register(registry);
        this.violatedGraphs = Counter.builder("execution.graphs")
            .description("Completed execution graphs")
            .tag("outcome", "invariant_violation")
            .register(registry);
    }

    public void recordRejection(String code) {
        Counter.builder(REJECTIONS)
            .description("Requests rejected for missing or invalid execution context")
            .tag("code", code)
            .register(registry)
            .increment();
    }

    public void recordCompleted(boolean valid) {
        if (valid) {
            validGraphs.increment();
        } else {
            violatedGraphs.increment();
        }
    }

    public long getCompletedCount() {
        return (long) (validGraphs.count() + violatedGraphs.count());
    }

    public long getViolationCount() {
        return (long) violatedGraphs.count();
    }

    public long getRejectionCount() {
        return (long) registry.find(REJECTIONS).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }
}
