package ai.anchor.sessions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Provider and sampling settings attached to a session.
 */
public record LlmConfig(String provider, String model, double temperature, int maxTokens) {
    public static final String DEFAULT_PROVIDER = "anthropic";
    public static final String DEFAULT_MODEL = "claude-3-5-sonnet-20241022";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 4096;

    public LlmConfig {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        if (provider.isBlank() || model.isBlank()) {
            throw new IllegalArgumentException("provider and model must not be blank");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be within [0, 2]: " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }

    public static LlmConfig defaults() {
        return new LlmConfig(DEFAULT_PROVIDER, DEFAULT_MODEL, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }

    /** String-valued form used by the on-disk record. */
    public Map<String, String> toStringMap() {
        var map = new LinkedHashMap<String, String>();
        map.put("provider", provider);
        map.put("model", model);
        map.put("temperature", Double.toString(temperature));
        map.put("max_tokens", Integer.toString(maxTokens));
        return map;
    }
}
