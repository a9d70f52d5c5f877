package io.github.samzhu.tracehub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.tracehub.handler.ReadinessHandler;

/**
 * 營運端點路由配置
 *
 * <p>定義端點路由：
 * <ul>
 *   <li>{@code GET /ready} - 就緒檢查</li>
 * </ul>
 *
 * <p>{@code /health} 與 {@code /metrics} 由 Actuator 提供（management base path 為 {@code /}，
 * {@code prometheus} 端點對應到 {@code /metrics}），設定位於 {@code application.yaml}。
 *
 * @see ReadinessHandler
 */
@Configuration
public class OperationalRoutesConfig {

    private static final Logger log = LoggerFactory.getLogger(OperationalRoutesConfig.class);

    private final ReadinessHandler readinessHandler;

    public OperationalRoutesConfig(ReadinessHandler readinessHandler) {
        this.readinessHandler = readinessHandler;
    }

    @Bean
    public RouterFunction<ServerResponse> operationalRoutes() {
        log.info("Configuring operational route: /ready");
        return RouterFunctions.route()
            .GET("/ready", readinessHandler::handleReady)
            .build();
    }
}
