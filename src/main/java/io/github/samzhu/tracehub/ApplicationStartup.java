package io.github.samzhu.tracehub;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import io.github.samzhu.tracehub.config.ExecutionProperties;
import jakarta.annotation.PostConstruct;

/**
 * 應用程式啟動處理器
 *
 * <p>在應用程式完全啟動後執行初始化任務，包括：
 * <ul>
 *   <li>驗證配置正確性（Profile 衝突檢查）</li>
 *   <li>輸出啟動資訊（URL、Profile、JVM、建置資訊、執行追蹤設定）</li>
 * </ul>
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
        .withZone(ZoneId.systemDefault());

    private final Environment env;
    private final ExecutionProperties executionProperties;
    private final Optional<BuildProperties> buildProperties;

    public ApplicationStartup(
            Environment env,
            ExecutionProperties executionProperties,
            Optional<BuildProperties> buildProperties) {
        this.env = env;
        this.executionProperties = executionProperties;
        this.buildProperties = buildProperties;
    }

    /**
     * 檢查 dev 和 prod 不能同時啟用
     */
    @PostConstruct
    public void initApplication() {
        Collection<String> activeProfiles = Arrays.asList(env.getActiveProfiles());
        if (activeProfiles.contains("dev") && activeProfiles.contains("prod")) {
            log.error("Misconfiguration: profiles 'dev' and 'prod' must not be active at the same time");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        logApplicationStartup();
    }

    private void logApplicationStartup() {
        String applicationName = env.getProperty("spring.application.name");
        String serverPort = env.getProperty("server.port", "8080");
        String contextPath = Optional.ofNullable(env.getProperty("server.servlet.context-path"))
            .filter(StringUtils::isNotBlank)
            .orElse("/");
        String hostAddress = "localhost";
        try {
            hostAddress = InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("Unable to resolve host address, falling back to `localhost`");
        }

        String[] activeProfiles = env.getActiveProfiles();
        Object profiles = activeProfiles.length > 0
            ? Arrays.toString(activeProfiles)
            : Arrays.toString(env.getDefaultProfiles());

        String version = buildProperties.map(BuildProperties::getVersion).orElse("N/A");
        String buildTime = buildProperties
            .map(BuildProperties::getTime)
            .map(DATE_FORMATTER::format)
            .orElse("N/A");

        log.info("""

            ----------------------------------------------------------
            \tApplication '{}' is running!
            ----------------------------------------------------------
            \tLocal:    http://localhost:{}{}
            \tExternal: http://{}:{}{}
            \tProfiles: {}
            \tVersion:  {} (built {})
            \tJava:     {} ({} processors)
            ----------------------------------------------------------
            \tRepo span name:      {}
            \tExtra exempt paths:  {}
            ----------------------------------------------------------""",
            applicationName,
            serverPort,
            contextPath,
            hostAddress,
            serverPort,
            contextPath,
            profiles,
            version,
            buildTime,
            System.getProperty("java.version"),
            Runtime.getRuntime().availableProcessors(),
            executionProperties.repoName(),
            executionProperties.additionalOperationalPaths()
        );
    }
}
