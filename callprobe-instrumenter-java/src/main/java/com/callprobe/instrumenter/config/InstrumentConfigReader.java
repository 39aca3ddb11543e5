package com.callprobe.instrumenter.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class InstrumentConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes instrument.json from the given path.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public InstrumentConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile())) {
            InstrumentConfig config = GSON.fromJson(reader, InstrumentConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config file: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
