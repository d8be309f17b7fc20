package com.webservice.customerio.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.webservice.customerio.util.JsonUtil;
import io.vertx.config.spi.utils.JsonObjectHelper;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.json.JsonObject;
import lombok.experimental.UtilityClass;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Settings are layered: classpath defaults, then the file named by {@code CUSTOMERIO_SETTINGS},
 * then environment variables prefixed with {@code customerio.}.
 */
@UtilityClass
public class Settings {

    public static final String DEFAULT_SETTINGS_FILE = "customerio.settings.json";
    public static final String SETTINGS_FILE_ENV = "CUSTOMERIO_SETTINGS";
    public static final String ENV_PREFIX = "customerio.";

    /**
     * Keys bound to strings, their env values are taken verbatim: a site id like {@code 00123} is not a number.
     */
    private static final Set<String> STRING_KEYS = Set.of("siteId", "apiKey", "trackingEndpoint", "apiEndpoint", "userAgent");

    public static JsonObject settings() throws IOException {
        return settings(System.getenv());
    }

    static JsonObject settings(Map<String, String> env) throws IOException {
        return defaultSettings()
                .mergeIn(fileSettings(env), true)
                .mergeIn(envSettings(env), true);
    }

    public static ClientSettings clientSettings(JsonObject settings) {
        try {
            return JsonUtil.MAPPER.readValue(settings.encode(), ClientSettings.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid client settings: " + e.getOriginalMessage(), e);
        }
    }

    public static HttpClientOptions httpClientOptions(JsonObject settings) {
        return new HttpClientOptions(settings.getJsonObject("client", new JsonObject()));
    }

    private static JsonObject defaultSettings() throws IOException {
        try (InputStream stream = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_SETTINGS_FILE)) {
            Objects.requireNonNull(stream, "Default resource file with settings is not found");
            String json = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            return new JsonObject(json);
        }
    }

    private static JsonObject fileSettings(Map<String, String> env) throws IOException {
        String file = env.get(SETTINGS_FILE_ENV);
        if (file == null) {
            return new JsonObject();
        }

        try (InputStream stream = new FileInputStream(file)) {
            String json = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            return new JsonObject(json);
        }
    }

    private static JsonObject envSettings(Map<String, String> env) {
        Properties properties = new Properties();

        for (Map.Entry<String, String> entry : env.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(ENV_PREFIX)) {
                properties.put(key.substring(ENV_PREFIX.length()), entry.getValue());
            }
        }

        JsonObject settings = JsonObjectHelper.from(properties, false, true);
        for (String key : STRING_KEYS) {
            String value = properties.getProperty(key);
            if (value != null) {
                settings.put(key, value);
            }
        }

        return settings;
    }
}
