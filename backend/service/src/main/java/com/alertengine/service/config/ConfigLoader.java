package com.alertengine.service.config;

import com.alertengine.core.util.JsonUtils;
import com.alertengine.engine.config.EngineSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    public static final String ENGINE_FILE = "engine.json";

    private ConfigLoader() {
    }

    /**
     * Reads {@code engine.json} from {@code configDir}. A missing file gives the defaults; missing or
     * non-positive fields fall back to their defaults one by one.
     */
    public static EngineSettings loadEngineSettings(Path configDir) {
        Path path = configDir.resolve(ENGINE_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + " found; using default engine settings");
            return EngineSettings.defaults();
        }
        try (InputStream in = Files.newInputStream(path)) {
            EngineSettings settings = JsonUtils.objectMapper().readValue(in, EngineSettings.class);
            return settings == null ? EngineSettings.defaults() : settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
