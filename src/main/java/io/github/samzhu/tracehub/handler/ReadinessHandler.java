package io.github.samzhu.tracehub.handler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.availability.ApplicationAvailability;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * 就緒檢查處理器
 *
 * <p>處理 {@code GET /ready}，回報 Spring Boot 的 readiness 狀態：
 * <ul>
 *   <li>{@code ACCEPTING_TRAFFIC} - 200，{@code ready: true}</li>
 *   <li>{@code REFUSING_TRAFFIC} - 503，{@code ready: false}</li>
 * </ul>
 *
 * <p>屬於營運路徑，不需要執行上下文。
 *
 * @see io.github.samzhu.tracehub.config.OperationalRoutesConfig
 */
@Component
public class ReadinessHandler {

    private static final Logger log = LoggerFactory.getLogger(ReadinessHandler.class);

    private final ApplicationAvailability availability;

    public ReadinessHandler(ApplicationAvailability availability) {
        this.availability = availability;
    }

    public ServerResponse handleReady(ServerRequest request) {
        ReadinessState state = availability.getReadinessState();
        boolean ready = state == ReadinessState.ACCEPTING_TRAFFIC;
        if (!ready) {
            log.debug("Readiness check failed: state={}", state);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", ready);
        body.put("timestamp", Instant.now().toString());

        return ServerResponse.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }
}
