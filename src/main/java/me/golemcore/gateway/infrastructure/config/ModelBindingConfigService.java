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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.WireMode;
import me.golemcore.gateway.port.outbound.BindingStorePort;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * File-backed binding store.
 *
 * <p>
 * On first run, copies bundled {@code classpath:models.json} to the workspace
 * ({@code models/models.json} via StoragePort). Every lookup re-reads the
 * workspace file, so edits take effect on the next request without a restart.
 *
 * <p>
 * Provider credentials may be given inline ({@code apiKey}) or as the name of
 * an environment variable or property ({@code apiKeyEnv}).
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelBindingConfigService implements BindingStorePort {

    private final StoragePort storagePort;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;
    private final Environment environment;

    public ModelBindingConfigService(StoragePort storagePort, GatewayProperties properties,
            ObjectMapper objectMapper, Environment environment) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.environment = environment;
    }

    @PostConstruct
    public void init() {
        String directory = properties.getModels().getDirectory();
        String file = properties.getModels().getConfigFile();
        try {
            Boolean exists = storagePort.exists(directory, file).join();
            if (Boolean.TRUE.equals(exists)) {
                log.info("[Bindings] Using workspace config {}/{}", directory, file);
                return;
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Bindings] Failed to check workspace config: {}", e.getMessage());
        }
        seedFromClasspath(directory, file);
    }

    private void seedFromClasspath(String directory, String file) {
        ClassPathResource resource = new ClassPathResource(file);
        if (!resource.exists()) {
            log.warn("[Bindings] No {} found on classpath, gateway starts with no models", file);
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            String json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            storagePort.putText(directory, file, json).join();
            log.info("[Bindings] Seeded workspace config from classpath");
        } catch (IOException | RuntimeException e) {
            log.warn("[Bindings] Failed to seed config from classpath: {}", e.getMessage());
        }
    }

    @Override
    public Optional<ModelBinding> findById(long id) {
        return find(model -> model.getId() != null && model.getId() == id);
    }

    @Override
    public Optional<ModelBinding> findByKey(String key) {
        return find(model -> key.equals(model.getKey()));
    }

    @Override
    public Optional<ModelBinding> findByName(String modelName) {
        return find(model -> modelName.equals(model.getModelName()));
    }

    /**
     * All configured bindings, credentials included. For diagnostics only.
     */
    public List<ModelBinding> listBindings() {
        BindingsConfig config = loadConfig();
        List<ModelBinding> bindings = new ArrayList<>();
        for (ModelDefinition model : config.getModels()) {
            toBinding(config, model).ifPresent(bindings::add);
        }
        return bindings;
    }

    private Optional<ModelBinding> find(Predicate<ModelDefinition> predicate) {
        BindingsConfig config = loadConfig();
        return config.getModels().stream()
                .filter(Objects::nonNull)
                .filter(predicate)
                .map(model -> toBinding(config, model))
                .flatMap(Optional::stream)
                .findFirst();
    }

    BindingsConfig loadConfig() {
        String directory = properties.getModels().getDirectory();
        String file = properties.getModels().getConfigFile();
        try {
            String json = storagePort.getText(directory, file).join();
            if (json == null || json.isBlank()) {
                return new BindingsConfig();
            }
            return objectMapper.readValue(json, BindingsConfig.class);
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[Bindings] Failed to read {}/{}: {}", directory, file, e.getMessage());
            return new BindingsConfig();
        }
    }

    private Optional<ModelBinding> toBinding(BindingsConfig config, ModelDefinition model) {
        ProviderDefinition provider = model.getProvider() != null
                ? config.getProviders().get(model.getProvider())
                : null;
        if (provider == null) {
            log.warn("[Bindings] Model {} references unknown provider {}", model.getModelName(),
                    model.getProvider());
            return Optional.empty();
        }

        BackendKind kind;
        WireMode wireMode;
        try {
            kind = BackendKind.fromValue(model.getBackendKind() != null ? model.getBackendKind() : provider.getKind());
            wireMode = WireMode.fromValue(model.getWireMode());
        } catch (IllegalArgumentException e) {
            log.warn("[Bindings] Model {} has invalid configuration: {}", model.getModelName(), e.getMessage());
            return Optional.empty();
        }

        return Optional.of(ModelBinding.builder()
                .id(model.getId())
                .key(model.getKey())
                .modelName(model.getModelName())
                .displayName(model.getDisplayName())
                .providerName(model.getProvider())
                .backendKind(kind)
                .endpointBaseUrl(provider.getBaseUrl())
                .credential(resolveCredential(provider))
                .headers(provider.getHeaders() != null ? provider.getHeaders() : Map.of())
                .wireMode(wireMode)
                .supportsReasoning(model.isSupportsReasoning())
                .priceInputPerMillion(model.getInputCostPerMillion())
                .priceOutputPerMillion(model.getOutputCostPerMillion())
                .currency(model.getCurrency())
                .build());
    }

    private String resolveCredential(ProviderDefinition provider) {
        if (provider.getApiKey() != null && !provider.getApiKey().isBlank()) {
            return provider.getApiKey();
        }
        if (provider.getApiKeyEnv() != null && !provider.getApiKeyEnv().isBlank()) {
            return environment.getProperty(provider.getApiKeyEnv());
        }
        return null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BindingsConfig {
        private Map<String, ProviderDefinition> providers = new LinkedHashMap<>();
        private List<ModelDefinition> models = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderDefinition {
        /** openai, openai-compatible, ollama, or a backend kind name. */
        private String kind = "openai";
        private String baseUrl;
        private String apiKey;
        private String apiKeyEnv;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelDefinition {
        private Long id;
        private String key;
        private String modelName;
        private String displayName;
        private String provider;
        /** Overrides the provider kind, e.g. {@code responses}. */
        private String backendKind;
        private String wireMode = "auto";
        private boolean supportsReasoning;
        private BigDecimal inputCostPerMillion;
        private BigDecimal outputCostPerMillion;
        private String currency = "USD";
    }
}
