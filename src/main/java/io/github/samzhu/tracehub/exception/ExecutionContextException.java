package io.github.samzhu.tracehub.exception;

import io.github.samzhu.tracehub.model.ExecutionError;

/**
 * 執行上下文 Header 驗證失敗
 *
 * <p>由 {@link io.github.samzhu.tracehub.execution.ExecutionContextExtractor} 拋出，
 * 中介層轉為 HTTP 400，handler 不會被呼叫。
 */
public class ExecutionContextException extends RuntimeException {

    private final String code;

    private ExecutionContextException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static ExecutionContextException missing(String message) {
        return new ExecutionContextException(ExecutionError.MISSING_EXECUTION_CONTEXT, message);
    }

    public static ExecutionContextException invalid(String message) {
        return new ExecutionContextException(ExecutionError.INVALID_EXECUTION_CONTEXT, message);
    }

    /**
     * 錯誤代碼（{@code MISSING_EXECUTION_CONTEXT} 或 {@code INVALID_EXECUTION_CONTEXT}）
     */
    public String getCode() {
        return code;
    }
}
