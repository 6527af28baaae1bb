package me.golemcore.gateway.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.domain.support.RingBuffer;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import me.golemcore.gateway.port.outbound.UsageStorePort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists one usage record per dispatched request.
 *
 * <p>
 * Persistence is retried up to {@code gateway.usage.persist-attempts} times.
 * When all attempts fail the record is dropped with a warning and a
 * {@link GatewayEventType#USAGE_PERSIST_FAILED} event; the caller never sees
 * the failure. Recent records are also kept in memory for listing.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class UsageRecorder {

    private static final String LOG_PREFIX = "[Usage]";

    private final UsageStorePort usageStore;
    private final GatewayEventSink eventSink;
    private final GatewayProperties.UsageProperties settings;
    private final RingBuffer<UsageRecord> recentRecords;

    public UsageRecorder(UsageStorePort usageStore, GatewayEventSink eventSink, GatewayProperties properties) {
        this.usageStore = usageStore;
        this.eventSink = eventSink;
        this.settings = properties.getUsage();
        this.recentRecords = new RingBuffer<>(settings.getRecentCapacity() > 0 ? settings.getRecentCapacity() : 2000);
    }

    @PostConstruct
    void init() {
        if (!settings.isEnabled()) {
            log.info("{} Usage accounting disabled", LOG_PREFIX);
            return;
        }
        try {
            List<UsageRecord> persisted = usageStore.loadRecent(recentRecords.capacity());
            recentRecords.addAll(persisted);
            log.info("{} Loaded {} recent usage records from storage", LOG_PREFIX, persisted.size());
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted usage", LOG_PREFIX, e);
        }
    }

    /**
     * Records usage asynchronously. The returned {@link Mono} completes once
     * the record is persisted or dropped and never errors.
     */
    public Mono<Void> record(UsageRecord usageRecord) {
        if (!settings.isEnabled()) {
            log.debug("{} Accounting disabled, dropping record for {}", LOG_PREFIX, usageRecord.getBindingKey());
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> persist(usageRecord))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("{} Unexpected failure recording usage: {}", LOG_PREFIX, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Most recent records, newest first. The limit is clamped to
     * {@code 1..gateway.usage.max-list-limit}; null means the default limit.
     */
    public List<UsageRecord> recent(Integer limit) {
        int requested = limit != null ? limit : settings.getDefaultListLimit();
        int clamped = Math.max(1, Math.min(requested, settings.getMaxListLimit()));
        return recentRecords.newest(clamped);
    }

    private void persist(UsageRecord usageRecord) {
        recentRecords.add(usageRecord);

        int attempts = Math.max(1, settings.getPersistAttempts());
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                usageStore.append(usageRecord);
                log.debug("{} Recorded: model={}, in={}, out={}, cost={}, outcome={}", LOG_PREFIX,
                        usageRecord.getBindingKey(), usageRecord.getInputTokens(), usageRecord.getOutputTokens(),
                        usageRecord.getCost(), usageRecord.getOutcome());
                eventSink.publish(GatewayEventType.USAGE_RECORDED, usageRecord.getCorrelationId(),
                        summary(usageRecord, attempt));
                return;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.debug("{} Persist attempt {}/{} failed: {}", LOG_PREFIX, attempt, attempts, e.getMessage());
            }
        }

        log.warn("{} Failed to persist usage record for {} after {} attempts: {}", LOG_PREFIX,
                usageRecord.getBindingKey(), attempts, lastFailure.getMessage());
        Map<String, Object> payload = summary(usageRecord, attempts);
        payload.put("error", String.valueOf(lastFailure.getMessage()));
        eventSink.publish(GatewayEventType.USAGE_PERSIST_FAILED, usageRecord.getCorrelationId(), payload);
    }

    private Map<String, Object> summary(UsageRecord usageRecord, int attempts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", usageRecord.getBindingKey());
        payload.put("inputTokens", usageRecord.getInputTokens());
        payload.put("outputTokens", usageRecord.getOutputTokens());
        payload.put("attempts", attempts);
        return payload;
    }
}
