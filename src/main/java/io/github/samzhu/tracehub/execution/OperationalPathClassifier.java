package io.github.samzhu.tracehub.execution;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 營運路徑判斷
 *
 * <p>以下路徑不需要執行上下文，也不會注入 span 階層：
 * <ul>
 *   <li>{@code /health}、{@code /ready}、{@code /metrics} - 完全相符</li>
 *   <li>{@code /documentation} 開頭 - API 文件</li>
 *   <li>以 {@code /health} 或 {@code /metadata} 結尾 - agent 子資源的健康檢查與自我描述</li>
 *   <li>透過 {@code execution.additional-operational-paths} 設定的額外路徑（完全相符）</li>
 * </ul>
 *
 * <p>不可變，可跨執行緒共用。
 */
public final class OperationalPathClassifier {

    private static final Set<String> DEFAULT_EXACT_PATHS = Set.of("/health", "/ready", "/metrics");
    private static final String DOCUMENTATION_PREFIX = "/documentation";
    private static final List<String> INTROSPECTION_SUFFIXES = List.of("/health", "/metadata");

    private final Set<String> additionalPaths;

    public OperationalPathClassifier(Collection<String> additionalPaths) {
        this.additionalPaths = additionalPaths == null ? Set.of() : Set.copyOf(additionalPaths);
    }

    public static OperationalPathClassifier defaults() {
        return new OperationalPathClassifier(Set.of());
    }

    /**
     * @param path 請求路徑，若含 query string 會先移除
     * @return {@code true} 表示免除執行上下文檢查
     */
    public boolean isOperationalPath(String path) {
        if (path == null) {
            return false;
        }
        int query = path.indexOf('?');
        String bare = query >= 0 ? path.substring(0, query) : path;

        if (DEFAULT_EXACT_PATHS.contains(bare) || additionalPaths.contains(bare)) {
            return true;
        }
        if (bare.startsWith(DOCUMENTATION_PREFIX)) {
            return true;
        }
        return INTROSPECTION_SUFFIXES.stream().anyMatch(bare::endsWith);
    }
}
