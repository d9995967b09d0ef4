package org.dps.configurator.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;

public class OptionsLoader {
    private static final Logger logger = LoggerFactory.getLogger(OptionsLoader.class);
    private static final String OPTIONS_FILE = "configurator.json";

    private final Gson gson;

    public OptionsLoader() {
        gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public static Path defaultPath() {
        return Paths.get(System.getProperty("user.home"), ".dps", OPTIONS_FILE);
    }

    public ConfiguratorOptions load(Path optionsPath) {
        logger.debug("Loading options from {}", optionsPath);
        ConfiguratorOptions options;
        try {
            if (Files.exists(optionsPath)) {
                String json = Files.readString(optionsPath);
                options = gson.fromJson(json, ConfiguratorOptions.class);
                if (options == null) {
                    logger.warn("Options file exists but is empty, using defaults");
                    options = new ConfiguratorOptions();
                }
                logger.info("Options loaded from {}", optionsPath);
            } else {
                logger.debug("Options file not found, using defaults");
                options = new ConfiguratorOptions();
            }
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load options from {}", optionsPath, e);
            options = new ConfiguratorOptions();
        }
        ensureNonNullFields(options);
        return options;
    }

    private void ensureNonNullFields(ConfiguratorOptions options) {
        if (options.getEnvPrefix() == null) {
            options.setEnvPrefix("DPS");
        }
        if (options.getDisabledPresets() == null) {
            options.setDisabledPresets(new ArrayList<>());
        }
    }
}
