package com.partinspect.engine.context;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Map;

/**
 * Writes {@link TreeContext} trees as JSON. Nulls are serialized so that an unexpanded node
 * ({@code "children": null}) stays distinguishable from an empty one ({@code "children": []}).
 */
public class TreeContextSerializer {

    private static final Gson GSON = new GsonBuilder()
        .serializeNulls()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    public String toJson(TreeContext root) {
        return GSON.toJson(root);
    }

    public TreeContext fromJson(String json) {
        return GSON.fromJson(json, TreeContext.class);
    }

    /** A well-formed single-key error record, {@code {"error": message}}. */
    public String errorRecord(String message) {
        return GSON.toJson(Map.of("error", message == null ? "unknown error" : message));
    }
}
