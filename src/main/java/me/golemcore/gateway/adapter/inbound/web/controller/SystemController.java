package me.golemcore.gateway.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.LogsPageResponse;
import me.golemcore.gateway.adapter.inbound.web.logstream.GatewayLogService;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.infrastructure.config.ModelBindingConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health, configured models and recent application logs.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final GatewayLogService gatewayLogService;
    private final ModelBindingConfigService modelBindingConfigService;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("models", modelBindingConfigService.listBindings().size());
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/models")
    public Mono<ResponseEntity<List<Map<String, Object>>>> getModels() {
        List<Map<String, Object>> models = modelBindingConfigService.listBindings().stream()
                .map(this::describe)
                .toList();
        return Mono.just(ResponseEntity.ok(models));
    }

    @GetMapping("/logs")
    public Mono<ResponseEntity<LogsPageResponse>> getLogs(
            @RequestParam(required = false) Long beforeSeq,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String correlationId) {
        GatewayLogService.LogsSlice slice = gatewayLogService.getLogsPage(beforeSeq, limit, correlationId);
        return Mono.just(ResponseEntity.ok(LogsPageResponse.builder()
                .items(slice.items())
                .oldestSeq(slice.oldestSeq())
                .newestSeq(slice.newestSeq())
                .hasMore(slice.hasMore())
                .build()));
    }

    private Map<String, Object> describe(ModelBinding binding) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("id", binding.getId());
        model.put("key", binding.getKey());
        model.put("modelName", binding.getModelName());
        model.put("displayName", binding.getDisplayName());
        model.put("provider", binding.getProviderName());
        model.put("backendKind", binding.getBackendKind());
        model.put("wireMode", binding.getWireMode());
        model.put("supportsReasoning", binding.isSupportsReasoning());
        model.put("hasCredential", binding.hasCredential());
        model.put("inputCostPerMillion", binding.getPriceInputPerMillion());
        model.put("outputCostPerMillion", binding.getPriceOutputPerMillion());
        model.put("currency", binding.getCurrency());
        return model;
    }
}
