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
 * How strictly a binding's backend kind is applied. {@link #AUTO} lets the
 * caller or the model name switch a chat-completions binding to the responses
 * API; {@link #FORCED} always uses the configured kind.
 */
public enum WireMode {

    AUTO, FORCED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WireMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return WireMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
