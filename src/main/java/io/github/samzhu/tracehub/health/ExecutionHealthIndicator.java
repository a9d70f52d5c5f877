package io.github.samzhu.tracehub.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.tracehub.config.ExecutionProperties;
import io.github.samzhu.tracehub.service.ExecutionMetrics;

/**
 * 執行追蹤健康指標
 *
 * <p>Spring Boot Actuator 健康檢查元件，回報 repo 名稱與累計的 graph 統計。
 * 不變條件違規是單一請求的錯誤，不影響服務健康狀態，永遠回報 UP。
 *
 * <p>存取方式：{@code GET /health}
 *
 * <p>回應範例：
 * <pre>{@code
 * {
 *   "components": {
 *     "execution": {
 *       "status": "UP",
 *       "details": { "repoName": "analytics-hub", "graphsCompleted": 42, "invariantViolations": 1, "contextRejections": 3 }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @see ExecutionMetrics
 */
@Component("execution")
public class ExecutionHealthIndicator implements HealthIndicator {

    private final ExecutionProperties properties;
    private final ExecutionMetrics metrics;

    public ExecutionHealthIndicator(ExecutionProperties properties, ExecutionMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public Health health() {
        return Health.up()
            .withDetail("repoName", properties.repoName())
            .withDetail("graphsCompleted", metrics.getCompletedCount())
            .withDetail("invariantViolations", metrics.getViolationCount())
            .withDetail("contextRejections", metrics.getRejectionCount())
            .build();
    }
}
