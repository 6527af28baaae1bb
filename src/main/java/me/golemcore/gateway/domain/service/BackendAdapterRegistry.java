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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.port.outbound.BackendAdapter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes the available {@link BackendAdapter} beans by backend kind.
 *
 * <p>
 * One adapter per kind is expected: chat-completions, responses and local
 * NDJSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackendAdapterRegistry {

    private final List<BackendAdapter> adapters;

    private final Map<BackendKind, BackendAdapter> adaptersByKind = new EnumMap<>(BackendKind.class);

    @PostConstruct
    public void init() {
        for (BackendAdapter adapter : adapters) {
            adaptersByKind.put(adapter.getKind(), adapter);
            log.debug("Registered backend adapter: {}", adapter.getKind().getWireName());
        }
        for (BackendKind kind : BackendKind.values()) {
            if (!adaptersByKind.containsKey(kind)) {
                log.warn("No backend adapter registered for {}", kind.getWireName());
            }
        }
    }

    /**
     * Returns the adapter for the given backend kind.
     *
     * @throws IllegalStateException
     *             if no adapter handles the kind
     */
    public BackendAdapter getAdapter(BackendKind kind) {
        BackendAdapter adapter = adaptersByKind.get(kind);
        if (adapter == null) {
            throw new IllegalStateException("No backend adapter for " + kind);
        }
        return adapter;
    }
}
