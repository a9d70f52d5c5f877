package io.github.samzhu.tracehub.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 執行 Span 快照
 *
 * <p>由 {@code ExecutionGraph#toHierarchy()} 產生的不可變副本，欄位名稱採 snake_case：
 * <pre>{@code
 * {
 *   "span_id": "...",
 *   "parent_span_id": "...",
 *   "trace_id": "...",
 *   "span_type": "repo|agent",
 *   "name": "analytics-hub",
 *   "status": "ok|error",
 *   "start_time": "2026-01-01T00:00:00Z",
 *   "end_time": "2026-01-01T00:00:01Z",
 *   "attributes": {},
 *   "artifacts": []
 * }
 * }</pre>
 *
 * <p>{@code end_time} 未設定代表 span 仍在進行中，序列化時省略。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionSpan(
    @JsonProperty("span_id")
    String spanId,

    @JsonProperty("parent_span_id")
    String parentSpanId,

    @JsonProperty("trace_id")
    String traceId,

    @JsonProperty("span_type")
    SpanType spanType,

    String name,

    SpanStatus status,

    @JsonProperty("start_time")
    Instant startTime,

    @JsonProperty("end_time")
    Instant endTime,

    Map<String, Object> attributes,

    List<SpanArtifact> artifacts
) {
    @JsonIgnore
    public boolean isOpen() {
        return endTime == null;
    }
}
