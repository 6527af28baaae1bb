package me.golemcore.gateway.adapter.inbound.web;

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
import me.golemcore.gateway.adapter.inbound.web.dto.ValidationResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks the shape of a raw chat request body without resolving the model or
 * calling a backend. Errors are conditions the chat endpoint rejects;
 * warnings are accepted but likely mistakes.
 */
@Component
public class ChatRequestValidator {

    private static final Set<String> ROLES = Set.of("system", "user", "assistant", "tool");
    private static final List<String> MODEL_FIELDS = List.of("model_id", "modelId", "model_key", "modelKey",
            "model");
    private static final double MIN_TEMPERATURE = 0.0;
    private static final double MAX_TEMPERATURE = 2.0;

    public ValidationResponse validate(JsonNode body) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (body == null || !body.isObject() || body.isEmpty()) {
            errors.add("Request body is empty");
            return ValidationResponse.builder()
                    .valid(false)
                    .errors(errors)
                    .warnings(warnings)
                    .build();
        }

        boolean hasModel = MODEL_FIELDS.stream().anyMatch(field -> present(body.get(field)));
        if (!hasModel) {
            errors.add("No model specified. Use model_id, model_key or model");
        }

        JsonNode messages = body.get("messages");
        if (messages == null || messages.isNull()) {
            errors.add("No messages array provided");
        } else if (!messages.isArray()) {
            errors.add("messages must be an array");
        } else if (messages.isEmpty()) {
            errors.add("messages array is empty");
        } else {
            for (int i = 0; i < messages.size(); i++) {
                validateMessage(i, messages.get(i), errors, warnings);
            }
        }

        JsonNode temperature = body.get("temperature");
        if (present(temperature) && (!temperature.isNumber()
                || temperature.asDouble() < MIN_TEMPERATURE || temperature.asDouble() > MAX_TEMPERATURE)) {
            warnings.add("temperature should be between 0 and 2");
        }

        JsonNode maxTokens = maxTokens(body);
        if (present(maxTokens) && (!maxTokens.isIntegralNumber() || maxTokens.asLong() < 1)) {
            errors.add("max_tokens must be a positive integer");
        }

        JsonNode stream = body.get("stream");
        return ValidationResponse.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .structure(ValidationResponse.Structure.builder()
                        .hasModel(hasModel)
                        .hasMessages(messages != null && messages.isArray())
                        .messageCount(messages != null && messages.isArray() ? messages.size() : 0)
                        .hasTemperature(present(temperature))
                        .hasMaxTokens(present(maxTokens))
                        .stream(stream == null || stream.isNull() || stream.asBoolean(true))
                        .build())
                .build();
    }

    private void validateMessage(int index, JsonNode message, List<String> errors, List<String> warnings) {
        if (message == null || !message.isObject()) {
            errors.add("Message " + index + ": must be an object");
            return;
        }
        JsonNode role = message.get("role");
        if (!present(role) || !role.isTextual() || role.asText().isBlank()) {
            errors.add("Message " + index + ": missing role");
        } else if (!ROLES.contains(role.asText())) {
            warnings.add("Message " + index + ": unknown role '" + role.asText() + "'");
        }
        JsonNode content = message.get("content");
        boolean tool = role != null && "tool".equals(role.asText());
        if (!tool && (!present(content) || (content.isTextual() && content.asText().isEmpty()))) {
            warnings.add("Message " + index + ": missing content");
        }
    }

    private static JsonNode maxTokens(JsonNode body) {
        JsonNode value = body.get("max_tokens");
        return value != null ? value : body.get("maxTokens");
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }
}
