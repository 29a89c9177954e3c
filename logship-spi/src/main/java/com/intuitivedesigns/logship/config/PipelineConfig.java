/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.config;

import com.intuitivedesigns.logship.spi.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Properties-backed configuration.
 * Loads from an explicit path, -Dlogship.config.path or ENV 'LOGSHIP_CONFIG_PATH'.
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String PATH_PROPERTY = "logship.config.path";
    public static final String PATH_ENV = "LOGSHIP_CONFIG_PATH";

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(new Properties());
    }

    public static PipelineConfig of(Properties source) {
        Properties copy = new Properties();
        if (source != null) copy.putAll(source);
        return new PipelineConfig(copy);
    }

    /**
     * Resolves the configuration file and loads it.
     *
     * @param explicitPath path given on the command line, may be null
     * @throws ConfigurationException if a path was given but cannot be read
     */
    public static PipelineConfig load(String explicitPath) {
        // 1. Explicit path, then System Property, then Environment Variable
        String path = explicitPath;
        if (path == null || path.isBlank()) {
            path = System.getProperty(PATH_PROPERTY);
        }
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        if (path == null || path.isBlank()) {
            log.debug("No configuration file specified; using built-in defaults");
            return empty();
        }

        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            props.load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", props.size(), path);
        return new PipelineConfig(props);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {}: '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {}: '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }
}
