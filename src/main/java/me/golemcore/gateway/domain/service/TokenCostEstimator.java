package me.golemcore.gateway.domain.service;

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

import com.knuddels.jtokkit.api.EncodingType;
import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.TokenEstimate;
import me.golemcore.gateway.domain.model.TokenUsage;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Derives token counts and monetary cost for one request.
 *
 * <p>
 * Counts come from the backend when it reported them, otherwise from the local
 * tokenizer. Cost is always computed locally from the binding's per-million
 * prices and rounded to six decimal places (HALF_UP). Cost is null only when
 * the binding has no pricing; a configured zero price yields zero.
 */
@Service
@RequiredArgsConstructor
public class TokenCostEstimator {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);
    private static final int COST_SCALE = 6;

    private final TokenCounter tokenCounter;

    public TokenEstimate estimate(List<ChatMessage> messages, String completionText, ModelBinding binding,
            Optional<TokenUsage> authoritative) {
        EncodingType encoding = tokenCounter.encodingFor(binding.getModelName());

        int inputTokens;
        int outputTokens;
        String source;
        if (authoritative.isPresent()) {
            inputTokens = authoritative.get().inputTokens();
            outputTokens = authoritative.get().outputTokens();
            source = TokenEstimate.SOURCE_BACKEND;
        } else {
            inputTokens = tokenCounter.countChat(messages, encoding);
            outputTokens = tokenCounter.countText(completionText, encoding);
            source = TokenEstimate.SOURCE_ESTIMATED;
        }

        return new TokenEstimate(encoding.getName(), inputTokens, outputTokens,
                cost(inputTokens, outputTokens, binding), source);
    }

    /**
     * {@code round6(in * priceIn / 1e6 + out * priceOut / 1e6)}, or null when
     * no price is configured.
     */
    public BigDecimal cost(int inputTokens, int outputTokens, ModelBinding binding) {
        if (!binding.hasPricing()) {
            return null;
        }
        BigDecimal inputPrice = binding.getPriceInputPerMillion() != null
                ? binding.getPriceInputPerMillion()
                : BigDecimal.ZERO;
        BigDecimal outputPrice = binding.getPriceOutputPerMillion() != null
                ? binding.getPriceOutputPerMillion()
                : BigDecimal.ZERO;

        BigDecimal inputCost = BigDecimal.valueOf(inputTokens).multiply(inputPrice);
        BigDecimal outputCost = BigDecimal.valueOf(outputTokens).multiply(outputPrice);
        return inputCost.add(outputCost)
                .divide(ONE_MILLION, COST_SCALE, RoundingMode.HALF_UP);
    }
}
