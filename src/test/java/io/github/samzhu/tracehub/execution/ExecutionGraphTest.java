package io.github.samzhu.tracehub.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.tracehub.model.ExecutionContext;
import io.github.samzhu.tracehub.model.ExecutionSpan;
import io.github.samzhu.tracehub.model.GraphValidation;
import io.github.samzhu.tracehub.model.SpanHierarchy;
import io.github.samzhu.tracehub.model.SpanStatus;
import io.github.samzhu.tracehub.model.SpanType;

class ExecutionGraphTest {

    private static final String PARENT = "3f1c2a9e-8b7d-4c6e-9a5f-1b2c3d4e5f60";
    private static final String EXECUTION = "9b2e4d6f-1a3c-4e5f-8a7b-0c1d2e3f4a5b";
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private SteppingClock clock;
    private ExecutionGraph graph;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(T0);
        graph = new ExecutionGraph(new ExecutionContext(EXECUTION, PARENT), "analytics-hub", clock);
    }

    @Test
    void constructionOpensRepoSpanUnderCoreSpan() {
        ExecutionSpan repo = graph.toHierarchy().repoSpan();

        assertThat(repo.spanId()).isEqualTo(graph.repoSpanId());
        assertThat(repo.parentSpanId()).isEqualTo(PARENT);
        assertThat(repo.traceId()).isEqualTo(EXECUTION);
        assertThat(repo.spanType()).isEqualTo(SpanType.REPO);
        assertThat(repo.name()).isEqualTo("analytics-hub");
        assertThat(repo.status()).isEqualTo(SpanStatus.OK);
        assertThat(repo.startTime()).isEqualTo(T0);
        assertThat(repo.isOpen()).isTrue();
        assertThat(repo.attributes()).isEmpty();
        assertThat(repo.artifacts()).isEmpty();
    }

    @Test
    void agentSpansAreSiblingsOfTheRepoSpan() {
        String first = graph.startAgentSpan("consensus-agent", Map.of("signals", 3));
        String second = graph.startAgentSpan("data-processing-agent");

        SpanHierarchy hierarchy = graph.toHierarchy();

        assertThat(hierarchy.coreSpanId()).isEqualTo(PARENT);
        assertThat(hierarchy.agentSpans()).extracting(ExecutionSpan::spanId).containsExactly(first, second);
        assertThat(hierarchy.agentSpans()).allSatisfy(span -> {
            assertThat(span.parentSpanId()).isEqualTo(graph.repoSpanId());
            assertThat(span.traceId()).isEqualTo(EXECUTION);
            assertThat(span.spanType()).isEqualTo(SpanType.AGENT);
            assertThat(span.isOpen()).isTrue();
        });
        assertThat(hierarchy.agentSpans().get(0).attributes()).containsEntry("signals", 3);
    }

    @Test
    void spanIdsArePairwiseDistinct() {
        for (int i = 0; i < 50; i++) {
            graph.startAgentSpan("agent-" + i);
        }
        SpanHierarchy hierarchy = graph.toHierarchy();

        List<String> ids = Stream.concat(
                Stream.of(hierarchy.repoSpan().spanId()),
                hierarchy.agentSpans().stream().map(ExecutionSpan::spanId))
            .toList();

        assertThat(ids).hasSize(51).doesNotHaveDuplicates();
    }

    @Test
    void endAgentSpanSetsEndTimeAndStatusOnce() {
        String spanId = graph.startAgentSpan("x");
        clock.advance(Duration.ofMillis(40));
        graph.endAgentSpan(spanId, SpanStatus.ERROR);
        clock.advance(Duration.ofMillis(40));
        graph.endAgentSpan(spanId, SpanStatus.OK);

        ExecutionSpan span = graph.toHierarchy().agentSpans().get(0);

        assertThat(span.status()).isEqualTo(SpanStatus.ERROR);
        assertThat(span.endTime()).isEqualTo(T0.plusMillis(40));
    }

    @Test
    void endingUnknownSpanIsIgnored() {
        graph.startAgentSpan("x");

        graph.endAgentSpan("no-such-span", SpanStatus.ERROR);

        assertThat(graph.toHierarchy().agentSpans()).singleElement()
            .satisfies(span -> assertThat(span.isOpen()).isTrue());
    }

    @Test
    void artifactsAreAppendedWithTimestamp() {
        String spanId = graph.startAgentSpan("x");
        clock.advance(Duration.ofSeconds(1));
        graph.attachArtifact(spanId, "consensus-result", "art-1", Map.of("agreement", 0.8));
        graph.attachArtifact(spanId, "consensus-trace", "art-2", List.of(1, 2));

        ExecutionSpan span = graph.toHierarchy().agentSpans().get(0);

        assertThat(span.artifacts()).hasSize(2);
        assertThat(span.artifacts().get(0).artifactType()).isEqualTo("consensus-result");
        assertThat(span.artifacts().get(0).artifactId()).isEqualTo("art-1");
        assertThat(span.artifacts().get(0).timestamp()).isEqualTo(T0.plusSeconds(1));
        assertThat(span.artifacts().get(1).data()).isEqualTo(List.of(1, 2));
    }

    @Test
    void artifactForUnknownSpanIsIgnored() {
        graph.startAgentSpan("x");

        graph.attachArtifact("no-such-span", "result", "a", "data");

        assertThat(graph.toHierarchy().agentSpans().get(0).artifacts()).isEmpty();
    }

    @Test
    void artifactAfterSpanEndedIsRejected() {
        String spanId = graph.startAgentSpan("x");
        graph.endAgentSpan(spanId, SpanStatus.OK);

        graph.attachArtifact(spanId, "late", "a", "data");

        assertThat(graph.toHierarchy().agentSpans().get(0).artifacts()).isEmpty();
    }

    @Test
    void finalizeRepoSpanOverwritesOnRepeat() {
        clock.advance(Duration.ofMillis(10));
        graph.finalizeRepoSpan(SpanStatus.OK);
        clock.advance(Duration.ofMillis(10));
        graph.finalizeRepoSpan(SpanStatus.ERROR);

        ExecutionSpan repo = graph.toHierarchy().repoSpan();

        assertThat(repo.status()).isEqualTo(SpanStatus.ERROR);
        assertThat(repo.endTime()).isEqualTo(T0.plusMillis(20));
    }

    @Test
    void validationRequiresAtLeastOneAgentSpan() {
        GraphValidation empty = graph.validate();

        assertThat(empty.valid()).isFalse();
        assertThat(empty.error()).isEqualTo("No agent-level spans were emitted during execution");

        graph.startAgentSpan("x");

        assertThat(graph.validate().valid()).isTrue();
        assertThat(graph.validate().error()).isNull();
    }

    @Test
    void openAgentSpanStillSatisfiesValidation() {
        graph.startAgentSpan("never-ended");

        assertThat(graph.validate().valid()).isTrue();
    }

    @Test
    void renderingTwiceYieldsEqualHierarchies() {
        String spanId = graph.startAgentSpan("x", Map.of("operation", "sum"));
        graph.attachArtifact(spanId, "result", spanId, 42);
        graph.endAgentSpan(spanId, SpanStatus.OK);
        graph.finalizeRepoSpan(SpanStatus.OK);

        assertThat(graph.toHierarchy()).isEqualTo(graph.toHierarchy());
    }

    @Test
    void renderedHierarchyIsNotAffectedByLaterMutation() {
        String spanId = graph.startAgentSpan("x");
        SpanHierarchy before = graph.toHierarchy();

        graph.attachArtifact(spanId, "result", spanId, 1);
        graph.endAgentSpan(spanId, SpanStatus.ERROR);
        graph.startAgentSpan("y");
        graph.finalizeRepoSpan(SpanStatus.ERROR);

        assertThat(before.agentSpans()).hasSize(1);
        assertThat(before.agentSpans().get(0).isOpen()).isTrue();
        assertThat(before.agentSpans().get(0).status()).isEqualTo(SpanStatus.OK);
        assertThat(before.agentSpans().get(0).artifacts()).isEmpty();
        assertThat(before.repoSpan().isOpen()).isTrue();
    }

    @Test
    void callerAttributeMapIsCopied() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("operation", "sum");
        graph.startAgentSpan("x", attributes);

        attributes.put("operation", "changed");

        assertThat(graph.toHierarchy().agentSpans().get(0).attributes()).containsEntry("operation", "sum");
    }

    /**
     * 可手動推進的測試時鐘
     */
    private static final class SteppingClock extends Clock {
        private Instant now;

        private SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
