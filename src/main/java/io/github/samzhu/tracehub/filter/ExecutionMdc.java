package io.github.samzhu.tracehub.filter;

import org.slf4j.MDC;

import io.github.samzhu.tracehub.execution.ExecutionGraph;

/**
 * 將 trace ID 與 repo span ID 放入 MDC
 *
 * <p>類似 {@link org.slf4j.MDC.MDCCloseable}，但結束時還原為先前的值而不是直接移除。
 */
public final class ExecutionMdc implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String SPAN_ID = "spanId";

    private final String previousExecutionId = MDC.get(EXECUTION_ID);
    private final String previousSpanId = MDC.get(SPAN_ID);

    private ExecutionMdc() {
    }

    public static ExecutionMdc open(ExecutionGraph graph) {
        ExecutionMdc scope = new ExecutionMdc();
        MDC.put(EXECUTION_ID, graph.traceId());
        MDC.put(SPAN_ID, graph.repoSpanId());
        return scope;
    }

    @Override
    public void close() {
        restore(EXECUTION_ID, previousExecutionId);
        restore(SPAN_ID, previousSpanId);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
