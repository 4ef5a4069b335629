package com.example.ajml.domain;

import java.util.Objects;

/**
 * LLM settings: provider token (may be empty when undeclared), model name and client retry count.
 */
public record LlmConfig(String provider, String model, int maxRetries) {

    public static final int DEFAULT_MAX_RETRIES = 2;

    public LlmConfig {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
    }

    public static LlmConfig unset() {
        return new LlmConfig("", "", DEFAULT_MAX_RETRIES);
    }
}
