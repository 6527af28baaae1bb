package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link HttpProperties} - upstream HTTP client timeouts and pooling</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link ModelsProperties} - where model bindings are read from</li>
 * <li>{@link UsageProperties} - usage accounting persistence</li>
 * <li>{@link LogsProperties} - in-memory log buffer</li>
 * <li>{@link JournalProperties} - in-memory observability event journal</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private HttpProperties http = new HttpProperties();
    private StorageProperties storage = new StorageProperties();
    private ModelsProperties models = new ModelsProperties();
    private UsageProperties usage = new UsageProperties();
    private LogsProperties logs = new LogsProperties();
    private JournalProperties journal = new JournalProperties();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    @Data
    public static class ModelsProperties {
        private String directory = "models";
        private String configFile = "models.json";
    }

    @Data
    public static class UsageProperties {
        private boolean enabled = true;
        private String directory = "usage";
        private int persistAttempts = 3;
        private int recentCapacity = 2000;
        private int defaultListLimit = 200;
        private int maxListLimit = 2000;
    }

    @Data
    public static class LogsProperties {
        private boolean enabled = true;
        private String minLevel = "INFO";
        private int maxEntries = 5000;
        private int defaultPageSize = 200;
        private int maxPageSize = 1000;
        private int maxMessageChars = 8000;
        private int maxExceptionChars = 16000;
    }

    @Data
    public static class JournalProperties {
        private int capacity = 1000;
    }
}
