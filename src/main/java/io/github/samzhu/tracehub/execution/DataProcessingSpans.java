package io.github.samzhu.tracehub.execution;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

import io.github.samzhu.tracehub.model.ArtifactPayload;
import io.github.samzhu.tracehub.model.SpanStatus;

/**
 * 以單一 agent span 包裝資料處理操作
 *
 * <p>給不想自行管理 span 生命週期的 handler 使用：
 * <ul>
 *   <li>沒有 graph（營運路徑）時直接執行操作，不做任何追蹤</li>
 *   <li>開啟名為 {@code data-processing-agent} 的 span，屬性 {@code operation} 為操作名稱</li>
 *   <li>成功時可選擇由結果建立一個 artifact，再以 {@code ok} 結束 span</li>
 *   <li>失敗（包含 {@link Error}）時以 {@code error} 結束 span，並原樣拋出原始異常</li>
 * </ul>
 *
 * <p>使用方式：
 * <pre>{@code
 * Summary summary = DataProcessingSpans.withDataProcessingSpan(graph, "summarize-events",
 *     () -> aggregator.summarize(window),
 *     result -> new ArtifactPayload("event-summary", result));
 * }</pre>
 *
 * @see ExecutionGraph
 */
public final class DataProcessingSpans {

    public static final String AGENT_NAME = "data-processing-agent";
    public static final String OPERATION_ATTRIBUTE = "operation";

    private DataProcessingSpans() {
    }

    public static <T> T withDataProcessingSpan(Optional<ExecutionGraph> graph, String operationName,
                                               Callable<T> handler) throws Exception {
        return withDataProcessingSpan(graph, operationName, handler, null);
    }

    /**
     * 同步版本
     *
     * @param graph 請求的 execution graph，營運路徑為空
     * @param operationName 操作名稱，記錄於 span 屬性
     * @param handler 實際操作
     * @param artifactBuilder 由結果建立 artifact，可為 null
     * @return 操作結果
     * @throws Exception 操作本身拋出的原始異常
     */
    public static <T> T withDataProcessingSpan(Optional<ExecutionGraph> graph, String operationName,
                                               Callable<T> handler,
                                               Function<? super T, ArtifactPayload> artifactBuilder) throws Exception {
        if (graph.isEmpty()) {
            return handler.call();
        }
        ExecutionGraph executionGraph = graph.get();
        String spanId = startSpan(executionGraph, operationName);

        try {
            T result = handler.call();
            attach(executionGraph, spanId, result, artifactBuilder);
            executionGraph.endAgentSpan(spanId, SpanStatus.OK);
            return result;
        } catch (Throwable t) {
            executionGraph.endAgentSpan(spanId, SpanStatus.ERROR);
            throw t;
        }
    }

    public static <T> CompletableFuture<T> withDataProcessingSpanAsync(Optional<ExecutionGraph> graph,
                                                                       String operationName,
                                                                       Supplier<? extends CompletionStage<T>> handler) {
        return withDataProcessingSpanAsync(graph, operationName, handler, null);
    }

    /**
     * 非同步版本
     *
     * <p>span 在回傳的 stage 完成前保持開啟，可跨越任意數量的非同步邊界。
     * 失敗時回傳的 future 以原始異常（不包裝）完成。
     */
    public static <T> CompletableFuture<T> withDataProcessingSpanAsync(Optional<ExecutionGraph> graph,
                                                                       String operationName,
                                                                       Supplier<? extends CompletionStage<T>> handler,
                                                                       Function<? super T, ArtifactPayload> artifactBuilder) {
        if (graph.isEmpty()) {
            return handler.get().toCompletableFuture();
        }
        ExecutionGraph executionGraph = graph.get();
        String spanId = startSpan(executionGraph, operationName);

        CompletionStage<T> stage;
        try {
            stage = handler.get();
        } catch (RuntimeException | Error e) {
            executionGraph.endAgentSpan(spanId, SpanStatus.ERROR);
            throw e;
        }

        CompletableFuture<T> completion = new CompletableFuture<>();
        stage.whenComplete((result, error) -> {
            if (error != null) {
                executionGraph.endAgentSpan(spanId, SpanStatus.ERROR);
                completion.completeExceptionally(error);
                return;
            }
            try {
                attach(executionGraph, spanId, result, artifactBuilder);
                executionGraph.endAgentSpan(spanId, SpanStatus.OK);
                completion.complete(result);
            } catch (Throwable t) {
                executionGraph.endAgentSpan(spanId, SpanStatus.ERROR);
                completion.completeExceptionally(t);
            }
        });
        return completion;
    }

    private static String startSpan(ExecutionGraph graph, String operationName) {
        return graph.startAgentSpan(AGENT_NAME, Map.of(OPERATION_ATTRIBUTE, operationName));
    }

    private static <T> void attach(ExecutionGraph graph, String spanId, T result,
                                   Function<? super T, ArtifactPayload> artifactBuilder) {
        if (artifactBuilder == null) {
            return;
        }
        ArtifactPayload artifact = artifactBuilder.apply(result);
        graph.attachArtifact(spanId, artifact.artifactType(), spanId, artifact.data());
    }
}
