package io.github.samzhu.tracehub.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import io.github.samzhu.tracehub.exception.ExecutionContextException;
import io.github.samzhu.tracehub.model.ExecutionContext;

class ExecutionContextExtractorTest {

    private static final String PARENT = "3f1c2a9e-8b7d-4c6e-9a5f-1b2c3d4e5f60";
    private static final String EXECUTION = "9b2e4d6f-1a3c-4e5f-8a7b-0c1d2e3f4a5b";

    @Test
    void usesBothHeadersWhenValid() {
        ExecutionContext context = ExecutionContextExtractor.extract(EXECUTION, PARENT);

        assertThat(context.executionId()).isEqualTo(EXECUTION);
        assertThat(context.parentSpanId()).isEqualTo(PARENT);
    }

    @Test
    void missingParentSpanIdIsRejected() {
        assertThatThrownBy(() -> ExecutionContextExtractor.extract(EXECUTION, null))
            .isInstanceOf(ExecutionContextException.class)
            .extracting("code")
            .isEqualTo("MISSING_EXECUTION_CONTEXT");
    }

    @Test
    void emptyParentSpanIdCountsAsMissing() {
        assertThatThrownBy(() -> ExecutionContextExtractor.extract(null, ""))
            .isInstanceOf(ExecutionContextException.class)
            .extracting("code")
            .isEqualTo("MISSING_EXECUTION_CONTEXT");
    }

    @Test
    void malformedParentSpanIdIsInvalid() {
        assertThatThrownBy(() -> ExecutionContextExtractor.extract(EXECUTION, "not-a-uuid"))
            .isInstanceOf(ExecutionContextException.class)
            .hasMessage("x-parent-span-id must be a valid UUID")
            .extracting("code")
            .isEqualTo("INVALID_EXECUTION_CONTEXT");
    }

    @Test
    void missingExecutionIdGeneratesFreshTraceId() {
        ExecutionContext first = ExecutionContextExtractor.extract(null, PARENT);
        ExecutionContext second = ExecutionContextExtractor.extract(null, PARENT);

        assertThat(ExecutionContextExtractor.isUuid(first.executionId())).isTrue();
        assertThat(first.executionId()).isNotEqualTo(second.executionId());
    }

    @Test
    void malformedExecutionIdIsReplacedNotRejected() {
        ExecutionContext context = ExecutionContextExtractor.extract("exec-42", PARENT);

        assertThat(context.executionId()).isNotEqualTo("exec-42");
        assertThat(ExecutionContextExtractor.isUuid(context.executionId())).isTrue();
    }

    @Test
    void uuidMatchIsCaseInsensitive() {
        String upper = PARENT.toUpperCase();

        assertThat(ExecutionContextExtractor.extract(null, upper).parentSpanId()).isEqualTo(upper);
    }

    @Test
    void headerNamesAreCaseInsensitive() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Parent-Span-Id", PARENT);
        headers.add("X-EXECUTION-ID", EXECUTION);

        ExecutionContext context = ExecutionContextExtractor.extract(headers);

        assertThat(context.parentSpanId()).isEqualTo(PARENT);
        assertThat(context.executionId()).isEqualTo(EXECUTION);
    }
}
