package com.partinspect.render.input;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses a JSON document into plain Java values: insertion-ordered maps, lists, strings,
 * booleans, null, and Long or Double numbers.
 */
public class JsonDocumentReader {

    private static final Gson GSON = new GsonBuilder()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .serializeNulls()
        .create();

    public Object read(Path documentPath) {
        if (!Files.exists(documentPath)) {
            throw new DocumentReadException("Document not found: " + documentPath);
        }
        try (Reader reader = Files.newBufferedReader(documentPath, StandardCharsets.UTF_8)) {
            return GSON.fromJson(reader, Object.class);
        } catch (JsonParseException e) {
            throw new DocumentReadException("Malformed JSON in " + documentPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read " + documentPath + ": " + e.getMessage(), e);
        }
    }

    public Object parse(String json) {
        try {
            return GSON.fromJson(json, Object.class);
        } catch (JsonParseException e) {
            throw new DocumentReadException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    public static class DocumentReadException extends RuntimeException {
        public DocumentReadException(String message) { super(message); }
        public DocumentReadException(String message, Throwable cause) { super(message, cause); }
    }
}
