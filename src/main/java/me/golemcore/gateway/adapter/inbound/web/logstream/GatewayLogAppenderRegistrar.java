package me.golemcore.gateway.adapter.inbound.web.logstream;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Feeds the {@code /api/system/logs} buffer from the root logger.
 *
 * <p>
 * Events below {@code gateway.logs.min-level} are dropped before they reach
 * {@link GatewayLogService}. An unknown level name falls back to INFO.
 */
@Component
@Slf4j
public class GatewayLogAppenderRegistrar {

    static final String APPENDER_NAME = "GATEWAY_LOG_BUFFER";

    private final GatewayLogService gatewayLogService;
    private final Level minLevel;
    private BufferAppender appender;

    public GatewayLogAppenderRegistrar(GatewayLogService gatewayLogService, GatewayProperties properties) {
        this.gatewayLogService = gatewayLogService;
        this.minLevel = Level.toLevel(properties.getLogs().getMinLevel(), Level.INFO);
    }

    @PostConstruct
    void registerAppender() {
        if (!gatewayLogService.isEnabled()) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext loggerContext)) {
            log.warn("[Logs] Logback is not the active backend, log buffer stays empty");
            return;
        }
        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger.getAppender(APPENDER_NAME) != null) {
            return;
        }

        ThresholdFilter threshold = new ThresholdFilter();
        threshold.setLevel(minLevel.toString());
        threshold.setContext(loggerContext);
        threshold.start();

        appender = new BufferAppender(gatewayLogService);
        appender.setContext(loggerContext);
        appender.setName(APPENDER_NAME);
        appender.addFilter(threshold);
        appender.start();
        rootLogger.addAppender(appender);
    }

    @PreDestroy
    void unregisterAppender() {
        if (appender == null) {
            return;
        }
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext loggerContext) {
            loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(APPENDER_NAME);
        }
        appender.stop();
        appender = null;
    }

    Level getMinLevel() {
        return minLevel;
    }

    private static final class BufferAppender extends AppenderBase<ILoggingEvent> {

        private final GatewayLogService target;

        private BufferAppender(GatewayLogService target) {
            this.target = target;
        }

        @Override
        protected void append(ILoggingEvent event) {
            target.append(event);
        }
    }
}
