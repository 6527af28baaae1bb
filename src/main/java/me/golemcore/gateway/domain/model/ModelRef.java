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

/**
 * Caller-supplied model reference. Up to three identifiers, resolved with
 * strict precedence: id, then key, then backend model name.
 */
public record ModelRef(Long id, String key, String name) {

    public static ModelRef ofName(String name) {
        return new ModelRef(null, null, name);
    }

    public boolean hasId() {
        return id != null;
    }

    public boolean hasKey() {
        return key != null && !key.isBlank();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean isEmpty() {
        return !hasId() && !hasKey() && !hasName();
    }

    /**
     * Human-readable form of the authoritative identifier, for error messages.
     */
    public String describe() {
        if (hasId()) {
            return "id=" + id;
        }
        if (hasKey()) {
            return "key=" + key;
        }
        if (hasName()) {
            return "name=" + name;
        }
        return "<none>";
    }
}
