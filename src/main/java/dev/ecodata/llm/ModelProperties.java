package dev.ecodata.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the OpenAI-compatible chat endpoint, bound from {@code ecodata.model}.
 *
 * @param baseUrl endpoint root, e.g. {@code https://api.openai.com/v1} or an Ollama {@code /v1}
 * @param apiKey provider key; local endpoints accept any non-empty value
 * @param modelName model identifier
 * @param temperature sampling temperature in {@code [0, 2]}
 * @param timeoutSeconds per-call timeout
 * @param retry backoff for transient failures
 */
@ConfigurationProperties(prefix = "ecodata.model")
public record ModelProperties(
        String baseUrl,
        String apiKey,
        String modelName,
        double temperature,
        int timeoutSeconds,
        Retry retry
) {

    public ModelProperties {
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalStateException(
                    "ecodata.model.temperature must be in [0.0, 2.0], got: " + temperature);
        }
        if (timeoutSeconds < 1) {
            throw new IllegalStateException(
                    "ecodata.model.timeout-seconds must be at least 1, got: " + timeoutSeconds);
        }
    }

    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
