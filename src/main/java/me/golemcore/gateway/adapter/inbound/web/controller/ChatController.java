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
import me.golemcore.gateway.adapter.inbound.web.dto.ChatApiRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.StreamFrame;
import me.golemcore.gateway.domain.model.DispatchRequest;
import me.golemcore.gateway.domain.model.ModelRef;
import me.golemcore.gateway.domain.service.DispatchOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Canonical chat endpoint.
 *
 * <p>
 * {@code POST /api/v1/chat} streams SSE frames by default; with
 * {@code "stream": false} it returns {@code {content}}, or the raw backend
 * payload for the responses API.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ChatController {

    private final DispatchOrchestrator dispatchOrchestrator;

    @PostMapping("/chat")
    public Mono<ResponseEntity<Object>> chat(@RequestBody ChatApiRequest body,
            @RequestHeader(value = ChatResponses.CORRELATION_HEADER, required = false) String correlationHeader) {
        String correlationId = ChatResponses.correlationId(correlationHeader);
        ModelRef ref = new ModelRef(body.getModelId(), body.getModelKey(), body.getModel());
        DispatchRequest request = ChatResponses.toDispatch(body, ref, correlationId);

        if (request.isStream()) {
            return dispatchOrchestrator.stream(request)
                    .map(events -> ChatResponses.sse(events, StreamFrame::of, correlationId));
        }
        return dispatchOrchestrator.complete(request)
                .map(reply -> ChatResponses.reply(reply, correlationId));
    }
}
