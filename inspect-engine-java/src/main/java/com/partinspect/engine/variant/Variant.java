package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;

/**
 * Display behaviour of one value, chosen by {@link com.partinspect.engine.NodeClassifier}.
 *
 * Variants know how to describe a value and, for containers, how to enumerate its children.
 * They never recurse: each child is handed to a {@link ChildSink} and the traversal decides what
 * becomes of it.
 */
public abstract class Variant {

    protected final String name;
    protected final Object value;

    protected Variant(String name, Object value) {
        this.name = name;
        this.value = value;
    }

    public abstract NodeKind kind();

    public String title() {
        return name;
    }

    public String typeName() {
        return typeNameOf(value);
    }

    /** Concrete value text; empty for variants that only have children. */
    public String valueText() {
        return "";
    }

    public String prefix() {
        return "";
    }

    public String postfix() {
        return "";
    }

    /** True number of children, or null for value-only variants. */
    public Integer declaredChildCount() {
        return null;
    }

    /**
     * Feeds this value's children to {@code sink}, at most {@code maxItems} of them unless the
     * variant is exempt from the breadth budget. Value-only variants produce nothing.
     */
    public void expand(ChildSink sink, int maxItems) {
    }

    public static String typeNameOf(Object value) {
        if (value == null) return "null";
        Class<?> cls = value.getClass();
        String simple = cls.getSimpleName();
        return simple.isEmpty() ? cls.getName() : simple;
    }

    static int clamp(long count) {
        return (int) Math.min(count, Integer.MAX_VALUE);
    }
}
