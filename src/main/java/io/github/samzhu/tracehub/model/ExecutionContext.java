package io.github.samzhu.tracehub.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 執行上下文
 *
 * <p>每個請求從 Header 解析一次，生命週期與該請求的 {@code ExecutionGraph} 相同：
 * <ul>
 *   <li>{@code executionId} - Trace ID，請求內所有 span 共用（來自 {@code x-execution-id} 或自動產生）</li>
 *   <li>{@code parentSpanId} - 上游 core span 的 ID（來自 {@code x-parent-span-id}）</li>
 * </ul>
 *
 * @param executionId Trace ID
 * @param parentSpanId 上游 core span ID
 * @see io.github.samzhu.tracehub.execution.ExecutionContextExtractor
 */
public record ExecutionContext(
    @JsonProperty("execution_id")
    String executionId,

    @JsonProperty("parent_span_id")
    String parentSpanId
) {
    public ExecutionContext {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be blank");
        }
        if (parentSpanId == null || parentSpanId.isBlank()) {
            throw new IllegalArgumentException("parentSpanId cannot be blank");
        }
    }
}
