package io.github.samzhu.tracehub.filter;

import java.util.Optional;

import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.tracehub.execution.ExecutionGraph;

/**
 * 接收 execution graph 的同步 handler
 *
 * <p>graph 以參數明確傳遞；營運路徑上為 {@link Optional#empty()}。
 *
 * @see ExecutionContextFilter#traced(ExecutionHandler)
 */
@FunctionalInterface
public interface ExecutionHandler {

    ServerResponse handle(ServerRequest request, Optional<ExecutionGraph> graph) throws Exception;
}
