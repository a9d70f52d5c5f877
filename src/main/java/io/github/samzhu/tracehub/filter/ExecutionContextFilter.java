package io.github.samzhu.tracehub.filter;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.EntityResponse;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.tracehub.config.ExecutionProperties;
import io.github.samzhu.tracehub.exception.ExecutionContextException;
import io.github.samzhu.tracehub.exception.HandlerExceptionMapper;
import io.github.samzhu.tracehub.execution.ExecutionContextExtractor;
import io.github.samzhu.tracehub.execution.ExecutionGraph;
import io.github.samzhu.tracehub.execution.OperationalPathClassifier;
import io.github.samzhu.tracehub.model.ExecutionContext;
import io.github.samzhu.tracehub.model.ExecutionError;
import io.github.samzhu.tracehub.service.ExecutionMetrics;

/**
 * 執行上下文過濾器
 *
 * <p>將 {@link ExecutionHandler} 包裝成 Spring WebMvc.fn 的 {@link HandlerFunction}，
 * 在請求生命週期中執行：
 * <ol>
 *   <li>判斷是否為營運路徑：是則以空 graph 直接呼叫 handler，不做任何檢查（Exempt）</li>
 *   <li>解析 {@code x-execution-id} / {@code x-parent-span-id}：失敗時立即回應 400，
 *       handler 不會被呼叫（Rejected）</li>
 *   <li>建立 {@link ExecutionGraph}（開啟 repo span），以參數傳給 handler（GraphOpen）</li>
 *   <li>handler 回傳後交給 {@link ExecutionResponseComposer} 結束、驗證並組合最終回應；
 *       body 為 {@code CompletionStage} 時等到值產生後才組合</li>
 * </ol>
 *
 * <p>路由範例：
 * <pre>{@code
 * RouterFunctions.route()
 *     .GET("/events/summary", filter.traced((request, graph) ->
 *         ServerResponse.ok().body(DataProcessingSpans.withDataProcessingSpan(
 *             graph, "summarize-events", summarizer::summarize))))
 *     .build();
 * }</pre>
 *
 * @see ExecutionResponseComposer
 * @see io.github.samzhu.tracehub.execution.DataProcessingSpans
 */
@Component
public class ExecutionContextFilter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContextFilter.class);

    private final OperationalPathClassifier classifier;
    private final ExecutionProperties properties;
    private final ExecutionResponseComposer composer;
    private final HandlerExceptionMapper exceptionMapper;
    private final ExecutionMetrics metrics;

    public ExecutionContextFilter(
            OperationalPathClassifier classifier,
            ExecutionProperties properties,
            ExecutionResponseComposer composer,
            HandlerExceptionMapper exceptionMapper,
            ExecutionMetrics metrics) {
        this.classifier = classifier;
        this.properties = properties;
        this.composer = composer;
        this.exceptionMapper = exceptionMapper;
        this.metrics = metrics;
    }

    /**
     * 包裝同步 handler
     */
    public HandlerFunction<ServerResponse> traced(ExecutionHandler handler) {
        return request -> {
            Admission admission = admit(request);
            if (admission.state() == AdmissionState.EXEMPT) {
                return handler.handle(request, Optional.empty());
            }
            if (admission.state() == AdmissionState.REJECTED) {
                return admission.rejection();
            }

            ExecutionGraph graph = admission.graph();
            try (ExecutionMdc mdc = ExecutionMdc.open(graph)) {
                ServerResponse response;
                try {
                    response = handler.handle(request, Optional.of(graph));
                } catch (Exception e) {
                    response = exceptionMapper.toResponse(e);
                }
                return complete(graph, response);
            }
        };
    }

    /**
     * 包裝非同步 handler
     *
     * <p>graph 的結束與驗證在 handler 回傳的 stage 完成時執行。若 stage 永遠不完成
     * （例如客戶端中斷），graph 不會被驗證，隨請求一起被回收。
     */
    public HandlerFunction<ServerResponse> tracedAsync(AsyncExecutionHandler handler) {
        return request -> {
            Admission admission = admit(request);
            if (admission.state() == AdmissionState.EXEMPT) {
                return ServerResponse.async(handler.handle(request, Optional.empty()).toCompletableFuture());
            }
            if (admission.state() == AdmissionState.REJECTED) {
                return admission.rejection();
            }

            ExecutionGraph graph = admission.graph();
            CompletionStage<ServerResponse> stage;
            try (ExecutionMdc mdc = ExecutionMdc.open(graph)) {
                stage = handler.handle(request, Optional.of(graph));
            } catch (Exception e) {
                stage = CompletableFuture.failedFuture(e);
            }

            CompletableFuture<ServerResponse> completed = stage.toCompletableFuture()
                .handle((response, error) -> {
                    try (ExecutionMdc mdc = ExecutionMdc.open(graph)) {
                        ServerResponse result = error == null ? response : exceptionMapper.toResponse(unwrap(error));
                        return complete(graph, result);
                    }
                });
            return ServerResponse.async(completed);
        };
    }

    private Admission admit(ServerRequest request) {
        String path = request.path();
        if (classifier.isOperationalPath(path)) {
            log.trace("Operational path, skipping execution context: path={}", path);
            return Admission.exempt();
        }

        ExecutionContext context;
        try {
            context = ExecutionContextExtractor.extract(request.headers().asHttpHeaders());
        } catch (ExecutionContextException e) {
            log.warn("Rejected request without valid execution context: path={}, code={}", path, e.getCode());
            metrics.recordRejection(e.getCode());
            return Admission.rejected(ServerResponse.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ExecutionError.of(e.getCode(), e.getMessage())));
        }

        ExecutionGraph graph = new ExecutionGraph(context, properties.repoName());
        log.debug("Execution graph opened: path={}, traceId={}, parentSpanId={}, repoSpanId={}",
            path, context.executionId(), context.parentSpanId(), graph.repoSpanId());
        return Admission.open(graph);
    }

    /**
     * body 為 {@code CompletionStage} 時，graph 在 stage 完成後才結束，並以實際的值組合回應
     */
    private ServerResponse complete(ExecutionGraph graph, ServerResponse response) {
        if (!(response instanceof EntityResponse<?> entityResponse)
                || !(entityResponse.entity() instanceof CompletionStage<?> deferred)) {
            return composer.compose(graph, response);
        }
        CompletableFuture<ServerResponse> completed = deferred.toCompletableFuture()
            .handle((value, error) -> {
                try (ExecutionMdc mdc = ExecutionMdc.open(graph)) {
                    ServerResponse result = error == null
                        ? withEntity(response, value)
                        : exceptionMapper.toResponse(unwrap(error));
                    return composer.compose(graph, result);
                }
            });
        return ServerResponse.async(completed);
    }

    private static ServerResponse withEntity(ServerResponse response, Object value) {
        if (value == null) {
            return ServerResponse.status(response.statusCode())
                .headers(headers -> headers.addAll(response.headers()))
                .cookies(cookies -> cookies.addAll(response.cookies()))
                .build();
        }
        return EntityResponse.fromObject(value)
            .status(response.statusCode())
            .headers(headers -> headers.addAll(response.headers()))
            .cookies(cookies -> cookies.addAll(response.cookies()))
            .build();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private enum AdmissionState {
        EXEMPT,
        REJECTED,
        OPEN
    }

    /**
     * 請求進入時的判斷結果
     */
    private record Admission(
        AdmissionState state,
        ServerResponse rejection,
        ExecutionGraph graph
    ) {
        static Admission exempt() {
            return new Admission(AdmissionState.EXEMPT, null, null);
        }

        static Admission rejected(ServerResponse rejection) {
            return new Admission(AdmissionState.REJECTED, rejection, null);
        }

        static Admission open(ExecutionGraph graph) {
            return new Admission(AdmissionState.OPEN, null, graph);
        }
    }
}
