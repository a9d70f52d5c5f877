package io.github.samzhu.tracehub.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Span 層級
 *
 * <ul>
 *   <li>{@code core} - 上游呼叫端擁有的 span，本服務只引用其 ID，從不建立</li>
 *   <li>{@code repo} - 每個請求唯一的頂層 span，為 core span 的子節點</li>
 *   <li>{@code agent} - repo span 的子節點，代表一個業務工作單元</li>
 * </ul>
 */
public enum SpanType {
    CORE("core"),
    REPO("repo"),
    AGENT("agent");

    private final String value;

    SpanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
