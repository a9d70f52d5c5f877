package io.github.samzhu.tracehub.execution;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.tracehub.model.ExecutionContext;
import io.github.samzhu.tracehub.model.ExecutionSpan;
import io.github.samzhu.tracehub.model.GraphValidation;
import io.github.samzhu.tracehub.model.SpanArtifact;
import io.github.samzhu.tracehub.model.SpanHierarchy;
import io.github.samzhu.tracehub.model.SpanStatus;
import io.github.samzhu.tracehub.model.SpanType;

/**
 * 單一請求的執行 Span 累加器
 *
 * <p>每個請求建立一個實例，只能附加不能刪除：
 * <ul>
 *   <li>建構時立即開啟唯一的 repo span，parent 為上游 core span</li>
 *   <li>handler 透過 {@link #startAgentSpan(String, Map)} / {@link #endAgentSpan(String, SpanStatus)}
 *       建立 agent spans（皆為 repo span 的直接子節點，彼此為兄弟，不會巢狀）</li>
 *   <li>回應送出前由中介層呼叫 {@link #finalizeRepoSpan(SpanStatus)} 與 {@link #validate()}</li>
 *   <li>{@link #toHierarchy()} 產生不可變快照供序列化</li>
 * </ul>
 *
 * <p>不變條件：同一 graph 內所有 span 共用 {@code trace_id}；請求結束時至少要有一個 agent span。
 *
 * <p>執行緒安全：所有方法皆為 synchronized，讓跨越非同步邊界（在不同執行緒上恢復）的
 * 單一請求流程看到一致狀態。graph 本身不會被多個請求共用。
 *
 * @see DataProcessingSpans
 * @see io.github.samzhu.tracehub.filter.ExecutionContextFilter
 */
public class ExecutionGraph {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGraph.class);

    static final String NO_AGENT_SPANS = "No agent-level spans were emitted during execution";

    private final Clock clock;
    private final MutableSpan repoSpan;
    private final List<MutableSpan> agentSpans = new ArrayList<>();

    public ExecutionGraph(ExecutionContext context, String repoName) {
        this(context, repoName, Clock.systemUTC());
    }

    public ExecutionGraph(ExecutionContext context, String repoName, Clock clock) {
        this.clock = clock;
        this.repoSpan = new MutableSpan(
            newSpanId(),
            context.parentSpanId(),
            context.executionId(),
            SpanType.REPO,
            repoName,
            Map.of(),
            clock.instant());
    }

    /**
     * 開啟 agent span
     *
     * @param name agent 名稱
     * @return span ID，供後續 {@link #endAgentSpan} 與 {@link #attachArtifact} 使用
     */
    public String startAgentSpan(String name) {
        return startAgentSpan(name, Map.of());
    }

    public synchronized String startAgentSpan(String name, Map<String, ?> attributes) {
        MutableSpan span = new MutableSpan(
            newSpanId(),
            repoSpan.spanId,
            repoSpan.traceId,
            SpanType.AGENT,
            name,
            attributes,
            clock.instant());
        agentSpans.add(span);
        log.debug("Agent span started: name={}, spanId={}, traceId={}", name, span.spanId, span.traceId);
        return span.spanId;
    }

    /**
     * 結束 agent span
     *
     * <p>找不到 span 或 span 已結束時直接忽略，重複結束或競態不會讓請求失敗。
     */
    public synchronized void endAgentSpan(String spanId, SpanStatus status) {
        MutableSpan span = findAgentSpan(spanId);
        if (span == null) {
            log.debug("Ignoring end of unknown agent span: spanId={}", spanId);
            return;
        }
        if (span.endTime != null) {
            log.debug("Ignoring end of already ended agent span: spanId={}", spanId);
            return;
        }
        span.endTime = clock.instant();
        span.status = status;
    }

    /**
     * 附加產出物到 agent span
     *
     * <p>找不到 span 或 span 已結束時忽略。
     */
    public synchronized void attachArtifact(String spanId, String artifactType, String artifactId, Object data) {
        MutableSpan span = findAgentSpan(spanId);
        if (span == null) {
            log.debug("Ignoring artifact for unknown agent span: spanId={}, artifactType={}", spanId, artifactType);
            return;
        }
        if (span.endTime != null) {
            log.debug("Rejecting artifact for ended agent span: spanId={}, artifactType={}", spanId, artifactType);
            return;
        }
        span.artifacts.add(new SpanArtifact(artifactType, artifactId, data, clock.instant()));
    }

    /**
     * 結束 repo span；重複呼叫會覆寫結束時間與狀態
     */
    public synchronized void finalizeRepoSpan(SpanStatus status) {
        repoSpan.endTime = clock.instant();
        repoSpan.status = status;
    }

    public synchronized GraphValidation validate() {
        if (agentSpans.isEmpty()) {
            return GraphValidation.invalid(NO_AGENT_SPANS);
        }
        return GraphValidation.ok();
    }

    /**
     * 產生 span 階層快照
     *
     * <p>回傳的物件為副本，之後對 graph 的修改不會影響已產生的快照。
     */
    public synchronized SpanHierarchy toHierarchy() {
        return new SpanHierarchy(
            repoSpan.parentSpanId,
            repoSpan.snapshot(),
            agentSpans.stream().map(MutableSpan::snapshot).toList());
    }

    public String repoSpanId() {
        return repoSpan.spanId;
    }

    public String traceId() {
        return repoSpan.traceId;
    }

    public synchronized int agentSpanCount() {
        return agentSpans.size();
    }

    private MutableSpan findAgentSpan(String spanId) {
        for (MutableSpan span : agentSpans) {
            if (span.spanId.equals(spanId)) {
                return span;
            }
        }
        return null;
    }

    private static String newSpanId() {
        return UUID.randomUUID().toString();
    }

    /**
     * graph 內部持有的可變 span，只透過 {@link #snapshot()} 對外
     */
    private static final class MutableSpan {
        private final String spanId;
        private final String parentSpanId;
        private final String traceId;
        private final SpanType spanType;
        private final String name;
        private final Map<String, Object> attributes;
        private final List<SpanArtifact> artifacts = new ArrayList<>();
        private final Instant startTime;
        private Instant endTime;
        private SpanStatus status = SpanStatus.OK;

        private MutableSpan(String spanId, String parentSpanId, String traceId, SpanType spanType,
                            String name, Map<String, ?> attributes, Instant startTime) {
            this.spanId = spanId;
            this.parentSpanId = parentSpanId;
            this.traceId = traceId;
            this.spanType = spanType;
            this.name = name;
            this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
            this.startTime = startTime;
        }

        private ExecutionSpan snapshot() {
            return new ExecutionSpan(
                spanId,
                parentSpanId,
                traceId,
                spanType,
                name,
                status,
                startTime,
                endTime,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)),
                List.copyOf(artifacts));
        }
    }
}
