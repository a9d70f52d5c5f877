package io.github.samzhu.tracehub.filter;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.tracehub.execution.ExecutionGraph;

/**
 * 接收 execution graph 的非同步 handler
 *
 * <p>agent span 可在回傳的 stage 完成前跨越任意數量的非同步邊界；
 * graph 的結束與驗證在 stage 完成後才進行。
 *
 * @see ExecutionContextFilter#tracedAsync(AsyncExecutionHandler)
 */
@FunctionalInterface
public interface AsyncExecutionHandler {

    CompletionStage<ServerResponse> handle(ServerRequest request, Optional<ExecutionGraph> graph) throws Exception;
}
