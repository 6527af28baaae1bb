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

import me.golemcore.gateway.domain.model.GatewayEvent;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.support.RingBuffer;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the most recent gateway events in memory for the debug endpoint.
 */
@Service
public class GatewayEventJournal implements GatewayEventSink {

    private final Clock clock;
    private final RingBuffer<GatewayEvent> events;
    private final AtomicLong sequence = new AtomicLong(0);

    public GatewayEventJournal(Clock clock, GatewayProperties properties) {
        this.clock = clock;
        int capacity = properties.getJournal().getCapacity();
        this.events = new RingBuffer<>(capacity > 0 ? capacity : 1000);
    }

    @Override
    public void publish(GatewayEventType type, String correlationId, Map<String, Object> payload) {
        Map<String, Object> safePayload = payload != null ? new LinkedHashMap<>(payload) : Map.of();
        events.add(GatewayEvent.builder()
                .seq(sequence.incrementAndGet())
                .type(type)
                .timestamp(Instant.now(clock))
                .correlationId(correlationId)
                .payload(safePayload)
                .build());
    }

    /**
     * Most recent events, oldest first, optionally filtered by correlation id.
     */
    public List<GatewayEvent> recent(int limit, String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return events.latest(limit);
        }
        List<GatewayEvent> matching = events.snapshot().stream()
                .filter(event -> correlationId.equals(event.correlationId()))
                .toList();
        int from = Math.max(0, matching.size() - Math.max(limit, 0));
        return matching.subList(from, matching.size());
    }
}
