package me.golemcore.gateway.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Backend wire-protocol families the gateway can talk to.
 */
public enum BackendKind {

    CHAT_COMPLETIONS("chat_completions"), RESPONSES("responses"), LOCAL_NDJSON("local_ndjson");

    private final String wireName;

    BackendKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Parses the configured kind. Accepts the provider kinds used by older
     * configuration files ({@code openai}, {@code openai-compatible},
     * {@code ollama}).
     */
    @JsonCreator
    public static BackendKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CHAT_COMPLETIONS;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
        case "chat_completions", "openai", "openai_compatible" -> CHAT_COMPLETIONS;
        case "responses" -> RESPONSES;
        case "local_ndjson", "ollama" -> LOCAL_NDJSON;
        default -> throw new IllegalArgumentException("Unknown backend kind: " + value);
        };
    }
}
