package org.crosspress.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Configuration;

/**
 * Debug mode also turns on DEBUG output for the processor's own loggers, whatever
 * {@code logging.level.org.crosspress} says.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LoggingConfig {

    static final String APP_LOGGER = "org.crosspress";

    private final AppProperties appProperties;
    private final LoggingSystem loggingSystem;

    @PostConstruct
    void init() {
        if (appProperties.getDiagnostics().isDebug()) {
            loggingSystem.setLogLevel(APP_LOGGER, LogLevel.DEBUG);
            log.debug("Debug mode enabled, {} logging set to DEBUG", APP_LOGGER);
        }
    }
}
