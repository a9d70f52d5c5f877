package io.github.samzhu.tracehub.execution;

import java.util.UUID;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;

import io.github.samzhu.tracehub.exception.ExecutionContextException;
import io.github.samzhu.tracehub.model.ExecutionContext;

/**
 * 執行上下文解析器
 *
 * <p>從請求 Header 解析 {@link ExecutionContext}：
 * <ul>
 *   <li>{@code x-parent-span-id} - 必填，缺少時拋出 {@code MISSING_EXECUTION_CONTEXT}，
 *       不是 UUID 格式時拋出 {@code INVALID_EXECUTION_CONTEXT}</li>
 *   <li>{@code x-execution-id} - 選填，缺少或格式錯誤時自動產生新的 UUID（不視為錯誤）</li>
 * </ul>
 *
 * <p>純函式，無副作用。
 */
public final class ExecutionContextExtractor {

    public static final String HEADER_EXECUTION_ID = "x-execution-id";
    public static final String HEADER_PARENT_SPAN_ID = "x-parent-span-id";

    private static final Pattern UUID_PATTERN = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
        Pattern.CASE_INSENSITIVE);

    private ExecutionContextExtractor() {
    }

    /**
     * 從 Header 解析（名稱不分大小寫）
     */
    public static ExecutionContext extract(HttpHeaders headers) {
        return extract(headers.getFirst(HEADER_EXECUTION_ID), headers.getFirst(HEADER_PARENT_SPAN_ID));
    }

    /**
     * @param executionId {@code x-execution-id} 值，可為 null
     * @param parentSpanId {@code x-parent-span-id} 值，可為 null
     * @return 解析後的執行上下文
     * @throws ExecutionContextException parent span ID 缺少或格式錯誤
     */
    public static ExecutionContext extract(String executionId, String parentSpanId) {
        if (StringUtils.isEmpty(parentSpanId)) {
            throw ExecutionContextException.missing(
                HEADER_PARENT_SPAN_ID + " header is required for all non-operational requests");
        }
        if (!isUuid(parentSpanId)) {
            throw ExecutionContextException.invalid(HEADER_PARENT_SPAN_ID + " must be a valid UUID");
        }

        String traceId = isUuid(executionId) ? executionId : UUID.randomUUID().toString();
        return new ExecutionContext(traceId, parentSpanId);
    }

    static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }
}
