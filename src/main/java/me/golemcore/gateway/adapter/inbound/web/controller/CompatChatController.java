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
import lombok.extern.slf4j.Slf4j;
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
 * Chat endpoints kept for existing integrations.
 *
 * <ul>
 * <li>{@code /api/compat/llm-chat} addresses models by backend name only</li>
 * <li>{@code /api/compat/llm-workflows} frames deltas as
 * {@code {type:"llm.delta", data}} for the workflow engine</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/compat")
@RequiredArgsConstructor
@Slf4j
public class CompatChatController {

    private final DispatchOrchestrator dispatchOrchestrator;

    @PostMapping("/llm-chat")
    public Mono<ResponseEntity<Object>> llmChat(@RequestBody ChatApiRequest body,
            @RequestHeader(value = ChatResponses.CORRELATION_HEADER, required = false) String correlationHeader) {
        String correlationId = ChatResponses.correlationId(correlationHeader);
        log.debug("[Compat] llm-chat {} model={}", correlationId, body.getModel());
        DispatchRequest request = ChatResponses.toDispatch(body, ModelRef.ofName(body.getModel()), correlationId);
        return dispatch(request, correlationId, false);
    }

    @PostMapping("/llm-workflows")
    public Mono<ResponseEntity<Object>> llmWorkflows(@RequestBody ChatApiRequest body,
            @RequestHeader(value = ChatResponses.CORRELATION_HEADER, required = false) String correlationHeader) {
        String correlationId = ChatResponses.correlationId(correlationHeader);
        log.debug("[Compat] llm-workflows {} model={}", correlationId, body.getModel());
        ModelRef ref = new ModelRef(body.getModelId(), body.getModelKey(), body.getModel());
        DispatchRequest request = ChatResponses.toDispatch(body, ref, correlationId);
        return dispatch(request, correlationId, true);
    }

    private Mono<ResponseEntity<Object>> dispatch(DispatchRequest request, String correlationId,
            boolean workflowFraming) {
        if (request.isStream()) {
            return dispatchOrchestrator.stream(request)
                    .map(events -> ChatResponses.sse(events,
                            workflowFraming ? StreamFrame::forWorkflow : StreamFrame::of, correlationId));
        }
        return dispatchOrchestrator.complete(request)
                .map(reply -> ChatResponses.reply(reply, correlationId));
    }
}
