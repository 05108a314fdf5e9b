package com.partinspect.render.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class RenderConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes an inspection settings file.
     *
     * @throws RenderConfigReadException if the file is missing or malformed
     */
    public RenderConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new RenderConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            RenderConfig config = GSON.fromJson(reader, RenderConfig.class);
            if (config == null) {
                throw new RenderConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (NoSuchFileException e) {
            throw new RenderConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new RenderConfigReadException("Malformed config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RenderConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class RenderConfigReadException extends RuntimeException {
        public RenderConfigReadException(String message) { super(message); }
        public RenderConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
