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

import java.util.Objects;

/**
 * Normalized event vocabulary every backend adapter produces and every relay
 * and accounting step consumes. {@code DONE} and {@code ERROR} are terminal.
 */
public record CanonicalEvent(CanonicalEventType type, String text, String message) {

    private static final CanonicalEvent DONE = new CanonicalEvent(CanonicalEventType.DONE, null, null);

    public CanonicalEvent {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static CanonicalEvent delta(String text) {
        return new CanonicalEvent(CanonicalEventType.DELTA, text, null);
    }

    public static CanonicalEvent done() {
        return DONE;
    }

    public static CanonicalEvent error(String message) {
        return new CanonicalEvent(CanonicalEventType.ERROR, null,
                message != null && !message.isBlank() ? message : "Unknown upstream error");
    }

    public boolean isDelta() {
        return type == CanonicalEventType.DELTA;
    }

    public boolean isTerminal() {
        return type != CanonicalEventType.DELTA;
    }
}
