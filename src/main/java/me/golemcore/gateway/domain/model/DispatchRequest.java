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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Inbound chat call as received by the dispatch orchestrator, before model
 * resolution.
 */
@Value
@Builder
public class DispatchRequest {

    ModelRef modelRef;
    @Singular
    List<ChatMessage> messages;
    Double temperature;
    Integer maxTokens;
    boolean stream;
    boolean useResponses;
    boolean reasoning;
    String correlationId;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
