package io.github.samzhu.tracehub.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Span 最終狀態
 */
public enum SpanStatus {
    OK("ok"),
    ERROR("error");

    private final String value;

    SpanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 依 HTTP 狀態碼決定 span 狀態（小於 400 為 ok）
     */
    public static SpanStatus fromHttpStatus(int statusCode) {
        return statusCode < 400 ? OK : ERROR;
    }
}
