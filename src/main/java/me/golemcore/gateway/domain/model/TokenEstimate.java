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

import java.math.BigDecimal;

/**
 * Result of token and cost estimation. {@code cost} is null when the binding
 * has no pricing configured.
 *
 * @param source
 *            {@code estimated} when counts come from the local tokenizer,
 *            {@code backend} when the backend reported them
 */
public record TokenEstimate(String encoding, int inputTokens, int outputTokens, BigDecimal cost, String source) {

    public static final String SOURCE_ESTIMATED = "estimated";
    public static final String SOURCE_BACKEND = "backend";

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
