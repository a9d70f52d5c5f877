package io.github.samzhu.tracehub.filter;

import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ReactiveAdapterRegistry;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.EntityResponse;
import org.springframework.web.servlet.function.ServerResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.tracehub.execution.ExecutionGraph;
import io.github.samzhu.tracehub.model.ExecutionError;
import io.github.samzhu.tracehub.model.GraphValidation;
import io.github.samzhu.tracehub.model.SpanHierarchy;
import io.github.samzhu.tracehub.model.SpanStatus;
import io.github.samzhu.tracehub.service.ExecutionMetrics;

/**
 * 回應組合器
 *
 * <p>handler 完成後、回應交給 Servlet 容器之前的唯一決策點：
 * <ol>
 *   <li>依 handler 狀態碼結束 repo span（小於 400 為 ok，否則 error）並驗證 graph</li>
 *   <li>驗證失敗（沒有任何 agent span）：不論 handler 回傳什麼，一律改為 500
 *       {@code EXECUTION_INVARIANT_VIOLATION}，並附上部分階層</li>
 *   <li>body 為 JSON 物件：保留原欄位並加入 {@code _execution}</li>
 *   <li>其他 body（二進位、陣列、純文字、無 body、write function、非同步 entity）：
 *       原始回應原封不動寫出，階層序列化後放入 {@code x-execution-trace} Header</li>
 * </ol>
 *
 * @see ExecutionContextFilter
 */
@Component
public class ExecutionResponseComposer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionResponseComposer.class);

    public static final String TRACE_HEADER = "x-execution-trace";
    public static final String EXECUTION_FIELD = "_execution";

    private final ObjectMapper objectMapper;
    private final ObjectWriter headerWriter;
    private final ObjectReader bodyReader;
    private final ExecutionMetrics metrics;

    public ExecutionResponseComposer(ObjectMapper objectMapper, ExecutionMetrics metrics) {
        this.objectMapper = objectMapper;
        // Header 值只允許 ASCII
        this.headerWriter = objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
        this.bodyReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.metrics = metrics;
    }

    /**
     * 結束並驗證 graph，產生最終回應
     *
     * @param graph 本次請求的 execution graph
     * @param response handler（或異常轉換器）產生的回應
     * @return 送往客戶端的回應
     */
    public ServerResponse compose(ExecutionGraph graph, ServerResponse response) {
        int handlerStatus = response.statusCode().value();
        graph.finalizeRepoSpan(SpanStatus.fromHttpStatus(handlerStatus));

        GraphValidation validation = graph.validate();
        metrics.recordCompleted(validation.valid());

        if (!validation.valid()) {
            graph.finalizeRepoSpan(SpanStatus.ERROR);
            log.warn("Execution invariant violated: traceId={}, repoSpanId={}, handlerStatus={}",
                graph.traceId(), graph.repoSpanId(), handlerStatus);
            return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ExecutionError.invariantViolation(validation.error(), graph.toHierarchy()));
        }

        SpanHierarchy hierarchy = graph.toHierarchy();
        log.debug("Execution completed: traceId={}, agentSpans={}, status={}",
            graph.traceId(), hierarchy.agentSpans().size(), handlerStatus);

        ObjectNode body = asJsonObject(response);
        if (body != null) {
            body.set(EXECUTION_FIELD, objectMapper.valueToTree(hierarchy));
            return ServerResponse.status(response.statusCode())
                .headers(headers -> copyHeaders(response, headers))
                .cookies(cookies -> cookies.addAll(response.cookies()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
        }
        return withTraceHeader(response, serialize(hierarchy));
    }

    /**
     * 取得 body 的 JSON 物件副本；非 JSON 物件時回傳 null
     */
    private ObjectNode asJsonObject(ServerResponse response) {
        if (!(response instanceof EntityResponse<?> entityResponse)) {
            return null;
        }
        Object entity = entityResponse.entity();
        if (entity == null || entity instanceof byte[] || entity instanceof Resource || isDeferred(entity)) {
            return null;
        }
        try {
            JsonNode node;
            if (entity instanceof String text) {
                node = bodyReader.readTree(text);
            } else if (entity instanceof JsonNode json) {
                node = json.deepCopy();
            } else {
                node = objectMapper.valueToTree(entity);
            }
            return node instanceof ObjectNode object ? object : null;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Response body is not a JSON object, using {} header: {}", TRACE_HEADER, e.getMessage());
            return null;
        }
    }

    /**
     * {@code CompletionStage} 或 Reactive Streams {@code Publisher} 等尚未產生值的 body
     */
    static boolean isDeferred(Object entity) {
        return entity instanceof CompletionStage<?>
            || ReactiveAdapterRegistry.getSharedInstance().getAdapter(entity.getClass()) != null;
    }

    private ServerResponse withTraceHeader(ServerResponse response, String trace) {
        return new TracedServerResponse(response, trace);
    }

    private static void copyHeaders(ServerResponse response, HttpHeaders target) {
        target.addAll(response.headers());
        target.remove(HttpHeaders.CONTENT_LENGTH);
    }

    String serialize(SpanHierarchy hierarchy) {
        try {
            return headerWriter.writeValueAsString(hierarchy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution hierarchy", e);
        }
    }
}
