package me.golemcore.gateway.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.ChatMessage;

import java.util.List;
import java.util.Map;

/**
 * Canonical chat request body. Field names are snake_case; the camelCase
 * spellings used by older clients are accepted as aliases.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatApiRequest {

    private String model;

    @JsonProperty("model_key")
    @JsonAlias("modelKey")
    private String modelKey;

    @JsonProperty("model_id")
    @JsonAlias("modelId")
    private Long modelId;

    private List<ChatMessage> messages;

    private Double temperature;

    @JsonProperty("max_tokens")
    @JsonAlias("maxTokens")
    private Integer maxTokens;

    /** Defaults to streaming when absent. */
    private Boolean stream;

    @JsonProperty("use_responses")
    @JsonAlias("useResponses")
    private Boolean useResponses;

    private Boolean reasoning;

    private Map<String, Object> metadata;

    @JsonIgnore
    public boolean isStreaming() {
        return stream == null || stream;
    }
}
