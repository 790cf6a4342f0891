package com.photonize.config;

import com.photonize.logging.AppLogger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Resolves processing settings from bundled JSON defaults, overridden by system properties.
 * A {@code workers} value of zero or less means "one per available processor".
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String DEFAULTS_RESOURCE = "photonize-defaults.json";
    static final String WORKERS_PROPERTY = "photonize.workers";
    static final String STAGGER_PROPERTY = "photonize.staggerMs";
    static final String THUMBNAIL_PROPERTY = "photonize.thumbnailSize";
    static final String CLOSE_GRACE_PROPERTY = "photonize.closeGraceSec";
    static final String UPSCALER_PROPERTY = "photonize.upscaler";

    private static final ConfigService INSTANCE = new ConfigService(loadDefaults(), System.getProperties());

    private final JSONObject defaults;
    private final Properties overrides;

    ConfigService(JSONObject defaults, Properties overrides) {
        this.defaults = defaults == null ? new JSONObject() : defaults;
        this.overrides = overrides == null ? new Properties() : overrides;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public int getWorkerCount() {
        int configured = intValue(WORKERS_PROPERTY, "workers", 0);
        if (configured <= 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors());
        }
        return configured;
    }

    public Duration getStaggerDelay() {
        return Duration.ofMillis(Math.max(0, intValue(STAGGER_PROPERTY, "staggerMs", 100)));
    }

    public int getThumbnailSize() {
        return Math.max(16, intValue(THUMBNAIL_PROPERTY, "thumbnailSize", 200));
    }

    public Duration getCloseGracePeriod() {
        return Duration.ofSeconds(Math.max(1, intValue(CLOSE_GRACE_PROPERTY, "closeGraceSec", 5)));
    }

    public Optional<Path> getUpscalerExecutable() {
        String value = overrides.getProperty(UPSCALER_PROPERTY);
        if (value == null || value.isBlank()) {
            value = defaults.optString("upscaler", "");
        }
        if (value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(value.trim()));
    }

    private int intValue(String property, String key, int fallback) {
        String override = overrides.getProperty(property);
        if (override != null && !override.isBlank()) {
            try {
                return Integer.parseInt(override.trim());
            } catch (NumberFormatException ex) {
                LOGGER.warning(() -> "Ignoring non-numeric " + property + "=" + override);
            }
        }
        return defaults.optInt(key, fallback);
    }

    private static JSONObject loadDefaults() {
        try (InputStream in = ConfigService.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                return new JSONObject();
            }
            return new JSONObject(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException | JSONException ex) {
            LOGGER.warning(() -> "Could not read " + DEFAULTS_RESOURCE + ": " + ex.getMessage());
            return new JSONObject();
        }
    }
}
