package io.github.samzhu.tracehub.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 錯誤回應格式
 *
 * <p>錯誤結構：
 * <pre>{@code
 * {
 *   "success": false,
 *   "error": {
 *     "code": "MISSING_EXECUTION_CONTEXT|INVALID_EXECUTION_CONTEXT|EXECUTION_INVARIANT_VIOLATION|...",
 *     "message": "錯誤描述"
 *   },
 *   "_execution": { ... }
 * }
 * }</pre>
 *
 * <p>錯誤代碼：
 * <ul>
 *   <li>{@code MISSING_EXECUTION_CONTEXT} - 400，缺少 {@code x-parent-span-id}</li>
 *   <li>{@code INVALID_EXECUTION_CONTEXT} - 400，{@code x-parent-span-id} 不是 UUID</li>
 *   <li>{@code EXECUTION_INVARIANT_VIOLATION} - 500，請求結束時沒有任何 agent span</li>
 *   <li>{@code INVALID_REQUEST} / {@code REQUEST_FAILED} / {@code INTERNAL_ERROR} - handler 未處理的異常</li>
 * </ul>
 *
 * <p>{@code _execution} 只在 graph 已建立時出現；context 被拒絕的請求沒有 graph，因此不含此欄位。
 *
 * @see io.github.samzhu.tracehub.exception.HandlerExceptionMapper
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionError(
    boolean success,
    Error error,
    @JsonProperty("_execution")
    SpanHierarchy execution
) {
    public static final String MISSING_EXECUTION_CONTEXT = "MISSING_EXECUTION_CONTEXT";
    public static final String INVALID_EXECUTION_CONTEXT = "INVALID_EXECUTION_CONTEXT";
    public static final String EXECUTION_INVARIANT_VIOLATION = "EXECUTION_INVARIANT_VIOLATION";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String REQUEST_FAILED = "REQUEST_FAILED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public record Error(
        String code,
        String message
    ) {}

    public static ExecutionError of(String code, String message) {
        return new ExecutionError(false, new Error(code, message), null);
    }

    public static ExecutionError invariantViolation(String message, SpanHierarchy hierarchy) {
        return new ExecutionError(false, new Error(EXECUTION_INVARIANT_VIOLATION, message), hierarchy);
    }
}
