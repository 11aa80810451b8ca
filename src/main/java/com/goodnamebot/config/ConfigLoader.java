/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.config;

import com.goodnamebot.utils.JacksonConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Loads the two configuration sources of the bot.
 *
 * <p>Runtime settings come from {@code application.properties} on the classpath,
 * optionally overridden by {@code resources/application.properties} in the
 * working directory. The Slack token and trigger list come from the JSON file
 * named on the command line.
 *
 * <p>Runs before the logger exists, so progress is reported back through
 * {@link #getMessages()} rather than logged.
 */
public class ConfigLoader {

    public static final String DEFAULTS_RESOURCE = "application.properties";
    public static final Path EXTERNAL_OVERRIDES = Paths.get("resources", "application.properties");

    public static final String CONFIG_ACTIONS_KEY = "actions";
    public static final String CONFIG_TOKEN_KEY = "token";

    private final List<String> messages = new ArrayList<>();

    /**
     * Loads classpath defaults, then applies external overrides if present.
     *
     * @param externalOverrides overrides file, skipped when it does not exist
     * @throws ConfigurationException if the classpath defaults cannot be read
     */
    public Properties loadProperties(Path externalOverrides) {
        Properties config = new Properties();

        try (InputStream inputStream = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (inputStream == null) {
                throw new ConfigurationException(DEFAULTS_RESOURCE + " not found in classpath");
            }
            config.load(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + DEFAULTS_RESOURCE, e);
        }

        if (externalOverrides != null && Files.exists(externalOverrides)) {
            try (InputStream inputStream = Files.newInputStream(externalOverrides)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
                messages.add("Loaded " + externalConfig.size() + " configuration override(s) from "
                        + externalOverrides.toAbsolutePath());
            } catch (IOException e) {
                messages.add("Failed to load configuration overrides: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Reads and validates the bot configuration file.
     *
     * @param path location of the JSON configuration
     * @return the parsed configuration, with token and actions present
     * @throws ConfigurationException if the file is unreadable or a required key is missing
     */
    public BotConfig loadBotConfig(Path path) {
        BotConfig config;
        try {
            config = JacksonConfig.mapper().readValue(path.toFile(), BotConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config file " + path + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Config file " + path + " is empty");
        }
        if (config.getToken() == null || config.getToken().isBlank()) {
            throw new ConfigurationException("Config did not contain a value for key: " + CONFIG_TOKEN_KEY);
        }
        if (config.getActions() == null) {
            throw new ConfigurationException("Config did not contain a value for key: " + CONFIG_ACTIONS_KEY);
        }
        messages.add("Loaded " + config.getActions().size() + " trigger(s) from " + path);
        return config;
    }

    /**
     * Reads a numeric setting.
     *
     * @throws ConfigurationException if the value is not a valid long
     */
    public static long longProperty(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not a number: '" + value + "'", e);
        }
    }

    /**
     * Reads a numeric setting that must fit in an int.
     *
     * @throws ConfigurationException if the value is not a valid int
     */
    public static int intProperty(Properties properties, String key, int defaultValue) {
        long value = longProperty(properties, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigurationException("Property " + key + " is out of range: " + value);
        }
        return (int) value;
    }

    /**
     * @return progress notes collected while loading, in order
     */
    public List<String> getMessages() {
        return List.copyOf(messages);
    }
}
