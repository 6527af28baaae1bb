package me.golemcore.gateway.domain.service;

import java.util.regex.Pattern;

/**
 * Model-name conventions for reasoning-class models. Reasoning-class models
 * reject {@code temperature} and take a different token-budget parameter.
 */
public final class ReasoningModels {

    private static final Pattern REASONING_CLASS = Pattern.compile("^(gpt-5|o5)", Pattern.CASE_INSENSITIVE);

    private ReasoningModels() {
    }

    public static boolean isReasoningClass(String modelName) {
        return modelName != null && REASONING_CLASS.matcher(modelName).find();
    }
}
