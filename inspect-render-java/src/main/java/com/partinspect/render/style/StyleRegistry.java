package com.partinspect.render.style;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves styles by name, ignoring case.
 */
public class StyleRegistry {

    private final Map<String, Style> styles = new TreeMap<>();

    public static StyleRegistry withDefaults() {
        return new StyleRegistry()
            .register(new TextStyle())
            .register(new HtmlStyle())
            .register(new ContextStyle());
    }

    /** Adds or replaces the style registered under {@code style.name()}. */
    public StyleRegistry register(Style style) {
        styles.put(key(style.name()), style);
        return this;
    }

    public Style get(String name) {
        Style style = name == null ? null : styles.get(key(name));
        if (style == null) {
            throw new UnknownStyleException("Unknown inspection style: " + name + " (available: "
                + String.join(", ", styles.keySet()) + ")");
        }
        return style;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(styles.keySet());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static class UnknownStyleException extends RuntimeException {
        public UnknownStyleException(String message) { super(message); }
    }
}
