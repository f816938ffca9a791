package org.laminar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.function.Consumer;

public class SettingsHelper {

    private static final Logger log = LoggerFactory.getLogger(SettingsHelper.class);

    public static final String DEFAULT_RESOURCE = "laminar.json";
    public static final String ENV_PREFIX = "LAMINAR_";

    private static final ObjectMapper mapper = new ObjectMapper();

    public static LaminarSettings loadSettings() {
        return loadSettings(DEFAULT_RESOURCE, System.getenv());
    }

    /**
     * Reads settings from a classpath resource and applies the {@code LAMINAR_*} overrides found in
     * {@code env}. A missing resource leaves the built-in defaults in place.
     *
     * @throws IllegalStateException    if the resource exists but is not valid settings JSON
     * @throws IllegalArgumentException if a numeric override cannot be parsed
     */
    public static LaminarSettings loadSettings(String resourcePath, Map<String, String> env) {
        LaminarSettings settings = readResource(resourcePath);

        override(env, "ANTHROPIC_API_KEY", value -> settings.anthropicApiKey = value);
        override(env, "CLAUDE_MODEL", value -> settings.claudeModel = value);
        override(env, "CLAUDE_MAX_TOKENS", value -> settings.claudeMaxTokens = parseInt("CLAUDE_MAX_TOKENS", value));
        override(env, "CLAUDE_TEMPERATURE", value -> settings.claudeTemperature = parseDouble("CLAUDE_TEMPERATURE", value));
        override(env, "TIMEOUT_SECONDS", value -> settings.timeoutSeconds = parseInt("TIMEOUT_SECONDS", value));
        override(env, "EXTRACTION_POLICY", value -> settings.extractionPolicy = value);
        override(env, "OUTPUT_DIR", value -> settings.outputDir = value);

        validate(settings);
        return settings;
    }

    static void validate(LaminarSettings settings) {
        if (settings.claudeMaxTokens <= 0) {
            throw new IllegalArgumentException("claudeMaxTokens must be positive, got " + settings.claudeMaxTokens);
        }
        if (settings.timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, got " + settings.timeoutSeconds);
        }
        if (settings.claudeTemperature < 0.0 || settings.claudeTemperature > 1.0) {
            throw new IllegalArgumentException("claudeTemperature must be between 0 and 1, got " + settings.claudeTemperature);
        }
    }

    private static LaminarSettings readResource(String resourcePath) {
        try (InputStream is = SettingsHelper.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                log.debug("Settings resource {} not found, using defaults", resourcePath);
                return new LaminarSettings();
            }
            return mapper.readValue(is, LaminarSettings.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings: " + resourcePath, e);
        }
    }

    private static void override(Map<String, String> env, String name, Consumer<String> setter) {
        String value = env.get(ENV_PREFIX + name);
        if (value != null && !value.isBlank()) {
            setter.accept(value.trim());
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " is not a number: " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " is not a number: " + value, e);
        }
    }
}
