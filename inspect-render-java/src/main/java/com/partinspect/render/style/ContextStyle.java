package com.partinspect.render.style;

import com.partinspect.engine.context.TreeContext;
import com.partinspect.engine.context.TreeContextSerializer;

/**
 * The raw tree context as JSON, for external template engines and for debugging the inspector.
 */
public class ContextStyle implements Style {

    private final TreeContextSerializer serializer = new TreeContextSerializer();

    @Override
    public String name() {
        return "context";
    }

    @Override
    public String render(TreeContext root) {
        return serializer.toJson(root);
    }
}
