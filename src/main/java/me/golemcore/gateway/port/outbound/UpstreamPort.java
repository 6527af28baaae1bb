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
import me.golemcore.gateway.domain.model.WireRequest;
import reactor.core.publisher.Mono;

/**
 * HTTP transport to backends.
 *
 * <p>
 * Both operations fail with
 * {@link me.golemcore.gateway.domain.exception.UpstreamTransportException} on
 * network errors and
 * {@link me.golemcore.gateway.domain.exception.UpstreamProtocolException} when
 * the backend answers with a non-success status.
 */
public interface UpstreamPort {

    /**
     * Sends a streaming request and completes once response headers arrived.
     */
    Mono<UpstreamStream> open(WireRequest request);

    /**
     * Sends a non-streaming request and returns the parsed JSON reply.
     */
    Mono<JsonNode> exchange(WireRequest request);
}
