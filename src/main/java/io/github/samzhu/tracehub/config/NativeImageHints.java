package io.github.samzhu.tracehub.config;

import org.springframework.aot.hint.annotation.RegisterReflectionForBinding;
import org.springframework.context.annotation.Configuration;

import io.github.samzhu.tracehub.model.ArtifactPayload;
import io.github.samzhu.tracehub.model.ExecutionContext;
import io.github.samzhu.tracehub.model.ExecutionError;
import io.github.samzhu.tracehub.model.ExecutionSpan;
import io.github.samzhu.tracehub.model.SpanArtifact;
import io.github.samzhu.tracehub.model.SpanHierarchy;

/**
 * GraalVM Native Image 反射提示配置
 *
 * <p>反射類別（Jackson 序列化）：
 * <ul>
 *   <li>{@link SpanHierarchy} / {@link ExecutionSpan} / {@link SpanArtifact} - {@code _execution} 與 {@code x-execution-trace}</li>
 *   <li>{@link ExecutionError} - 錯誤回應</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/packaging/native-image/index.html">Spring Boot Native Image Support</a>
 */
@Configuration
@RegisterReflectionForBinding({
    SpanHierarchy.class,
    ExecutionSpan.class,
    SpanArtifact.class,
    ArtifactPayload.class,
    ExecutionContext.class,
    ExecutionError.class,
    ExecutionError.Error.class
})
public class NativeImageHints {
}
