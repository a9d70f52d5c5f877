package io.github.samzhu.tracehub.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.tracehub.model.ExecutionError;

/**
 * Handler 異常轉換器
 *
 * <p>traced handler 未處理的異常在這裡轉為錯誤回應，之後仍會經過 graph 的結束與驗證，
 * 讓錯誤回應同樣帶有 span 階層。異常本身不會被吞掉：一律記錄日誌並反映在狀態碼上。
 *
 * <p>處理的異常類型：
 * <ul>
 *   <li>{@code ResponseStatusException} - 沿用其狀態碼（REQUEST_FAILED）</li>
 *   <li>{@code IllegalArgumentException} - 400 Bad Request（INVALID_REQUEST）</li>
 *   <li>{@code Exception} - 500 Internal Server Error（INTERNAL_ERROR）</li>
 * </ul>
 *
 * @see ExecutionError
 */
@Component
public class HandlerExceptionMapper {

    private static final Logger log = LoggerFactory.getLogger(HandlerExceptionMapper.class);

    public ServerResponse toResponse(Throwable e) {
        if (e instanceof ResponseStatusException rse) {
            return handleResponseStatusException(rse);
        }
        if (e instanceof IllegalArgumentException iae) {
            return handleIllegalArgumentException(iae);
        }
        return handleGenericException(e);
    }

    private ServerResponse handleResponseStatusException(ResponseStatusException e) {
        log.warn("Handler failed with status {}: {}", e.getStatusCode().value(), e.getReason());
        String message = e.getReason() != null ? e.getReason() : e.getStatusCode().toString();
        return errorResponse(e.getStatusCode(), ExecutionError.of(ExecutionError.REQUEST_FAILED, message));
    }

    private ServerResponse handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, ExecutionError.of(ExecutionError.INVALID_REQUEST, e.getMessage()));
    }

    private ServerResponse handleGenericException(Throwable e) {
        log.error("Unexpected handler error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            ExecutionError.of(ExecutionError.INTERNAL_ERROR, "Internal server error"));
    }

    private ServerResponse errorResponse(HttpStatusCode status, ExecutionError body) {
        return ServerResponse.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }
}
