package io.github.samzhu.tracehub.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 回應中 {@code _execution} 欄位（或 {@code x-execution-trace} Header）的內容
 *
 * @param coreSpanId 上游 core span ID（即 repo span 的 parent）
 * @param repoSpan 本服務的 repo span
 * @param agentSpans 依建立順序排列的 agent spans
 */
public record SpanHierarchy(
    @JsonProperty("core_span_id")
    String coreSpanId,

    @JsonProperty("repo_span")
    ExecutionSpan repoSpan,

    @JsonProperty("agent_spans")
    List<ExecutionSpan> agentSpans
) {}
