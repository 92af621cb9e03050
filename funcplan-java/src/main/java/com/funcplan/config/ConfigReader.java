package com.funcplan.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates a config file.
     *
     * @throws ConfigReadException if the file is missing, malformed, or holds out-of-range values
     */
    public ToolConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        ToolConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, ToolConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty: " + configPath);
        }
        validate(config, configPath);
        System.err.println("[funcplan] Config: " + configPath);
        return config;
    }

    private void validate(ToolConfig config, Path configPath) {
        try {
            config.getUnsupportedPolicy();
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException(configPath + ": " + e.getMessage(), e);
        }
        requirePositive("label_max_length", config.getLabelMaxLength(), configPath);
        requirePositive("max_source_chars", config.getMaxSourceChars(), configPath);
        requirePositive("export_timeout_seconds", config.getExportTimeoutSeconds(), configPath);
        if (config.getDotExecutable().isBlank()) {
            throw new ConfigReadException(configPath + ": dot_executable must not be blank");
        }
    }

    private void requirePositive(String key, long value, Path configPath) {
        if (value <= 0) {
            throw new ConfigReadException(configPath + ": " + key + " must be positive, got " + value);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
