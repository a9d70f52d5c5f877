package io.github.samzhu.tracehub.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 執行追蹤配置屬性
 *
 * <p>從 application.yaml 中的 {@code execution} 前綴載入配置：
 * <ul>
 *   <li>{@code repoName} - repo span 名稱（預設: analytics-hub）</li>
 *   <li>{@code additionalOperationalPaths} - 額外免除執行上下文檢查的路徑（完全相符）</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * execution:
 *   repo-name: analytics-hub
 *   additional-operational-paths:
 *     - /version
 * </pre>
 *
 * @param repoName repo span 名稱
 * @param additionalOperationalPaths 額外的營運路徑
 * @see io.github.samzhu.tracehub.execution.OperationalPathClassifier
 */
@ConfigurationProperties(prefix = "execution")
public record ExecutionProperties(
    String repoName,
    List<String> additionalOperationalPaths
) {
    public ExecutionProperties {
        if (repoName == null || repoName.isBlank()) {
            repoName = "analytics-hub";
        }
        if (additionalOperationalPaths == null) {
            additionalOperationalPaths = List.of();
        }
    }
}
