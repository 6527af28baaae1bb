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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One accounting record per request that reached a backend. Append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UsageRecord {

    private Instant timestamp;
    private String bindingKey;
    private Long bindingId;
    private String modelName;
    private String providerName;
    private int inputTokens;
    private int outputTokens;
    private int promptChars;
    private int completionChars;
    private BigDecimal cost;
    private String currency;
    private String tokenSource;
    private UsageOutcome outcome;
    private String correlationId;
    private String conversationId;
    private Map<String, Object> metadata;

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
