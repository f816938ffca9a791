package org.laminar.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Application settings, read from {@code laminar.json} on the classpath and overridden by
 * {@code LAMINAR_*} environment variables.
 * <p>
 * Example laminar.json:
 * {
 *   "claudeModel": "claude-sonnet-4-20250514",
 *   "claudeMaxTokens": 8192,
 *   "extractionPolicy": "AUTO",
 *   "outputDir": "output"
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LaminarSettings {
    /**
     * Anthropic API key. Usually only given through LAMINAR_ANTHROPIC_API_KEY.
     */
    public String anthropicApiKey;

    public String claudeModel = "claude-sonnet-4-20250514";
    public int claudeMaxTokens = 8192;
    public double claudeTemperature = 0.0;

    /**
     * Timeout of a single oracle request, in seconds.
     */
    public int timeoutSeconds = 300;

    /**
     * One of AUTO, FORCE_AI, FORCE_TEMPLATE.
     */
    public String extractionPolicy = "AUTO";

    public String outputDir = "output";

    public boolean hasApiKey() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }
}
