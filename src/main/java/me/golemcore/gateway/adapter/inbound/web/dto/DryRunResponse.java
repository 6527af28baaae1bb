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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Cost preview for a request that is resolved but never sent to a backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DryRunResponse {

    @JsonProperty("dry_run")
    private boolean dryRun;
    private ModelInfo model;
    @JsonProperty("message_count")
    private int messageCount;
    private String encoding;
    @JsonProperty("input_tokens")
    private int inputTokens;
    @JsonProperty("estimated_output_tokens")
    private int estimatedOutputTokens;
    @JsonProperty("estimated_cost")
    private BigDecimal estimatedCost;
    private String currency;
    private String note;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelInfo {
        private Long id;
        private String key;
        private String name;
        @JsonProperty("display_name")
        private String displayName;
        private String backend;
    }
}
