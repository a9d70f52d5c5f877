package io.github.samzhu.tracehub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.support.ContextPropagatingTaskDecorator;

import io.github.samzhu.tracehub.filter.ExecutionMdc;
import io.micrometer.context.ContextRegistry;
import io.micrometer.context.integration.Slf4jThreadLocalAccessor;

/**
 * 可觀測性配置
 *
 * <p>配置 Context 傳播，確保執行上下文（{@code executionId}、{@code spanId}）在非同步任務間的日誌中仍然可見。
 *
 * <p>Spring Boot 3.2+ 行為：
 * <ul>
 *   <li>任何 {@link TaskDecorator} bean 會自動套用到 auto-configured executor</li>
 *   <li>非同步 handler 應使用注入的 {@code AsyncTaskExecutor}，才能帶上 MDC</li>
 * </ul>
 *
 * @see ExecutionMdc
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/task-execution-and-scheduling.html">Spring Boot Task Execution</a>
 */
@Configuration
public class ObservabilityConfig {

    /**
     * Context 傳播 TaskDecorator
     *
     * <p>將 MDC 中的 {@code executionId}、{@code spanId} 註冊到 {@link ContextRegistry}，
     * 由 {@link ContextPropagatingTaskDecorator} 在提交時擷取、執行時還原。
     *
     * @return ContextPropagatingTaskDecorator 實例
     */
    @Bean
    public TaskDecorator contextPropagatingTaskDecorator() {
        ContextRegistry.getInstance().registerThreadLocalAccessor(
            new Slf4jThreadLocalAccessor(ExecutionMdc.EXECUTION_ID, ExecutionMdc.SPAN_ID));
        return new ContextPropagatingTaskDecorator();
    }
}
