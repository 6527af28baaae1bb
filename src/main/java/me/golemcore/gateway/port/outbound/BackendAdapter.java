package me.golemcore.gateway.port.outbound;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.CanonicalChatRequest;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.WireRequest;

import java.util.List;
import java.util.Optional;

/**
 * Translates between the canonical contract and one backend wire protocol.
 *
 * <p>
 * Adapters are stateless: {@link #normalize(String)} is called once per wire
 * line, in arrival order, and returns the events that line produces. A line
 * that cannot be parsed yields no events.
 */
public interface BackendAdapter {

    BackendKind getKind();

    WireRequest encode(CanonicalChatRequest request);

    List<CanonicalEvent> normalize(String wireLine);

    /**
     * Extracts the completion text from a non-streaming reply.
     */
    String extractText(JsonNode reply);

    /**
     * Authoritative token usage reported in a non-streaming reply, if any.
     */
    Optional<TokenUsage> extractUsage(JsonNode reply);

    /**
     * Whether non-streaming replies are returned to the caller as received
     * rather than wrapped as {@code {content}}.
     */
    default boolean isRawReplyPassthrough() {
        return false;
    }
}
