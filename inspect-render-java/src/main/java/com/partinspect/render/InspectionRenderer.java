package com.partinspect.render;

import com.partinspect.engine.InspectionManager;
import com.partinspect.engine.Node;
import com.partinspect.engine.context.TreeContextBuilder;
import com.partinspect.render.style.Style;
import com.partinspect.render.style.StyleRegistry;

/**
 * Inspects a value and renders the resulting tree with a named style.
 */
public class InspectionRenderer {

    private final InspectionManager manager;
    private final StyleRegistry styles;

    public InspectionRenderer(InspectionManager manager, StyleRegistry styles) {
        this.manager = manager;
        this.styles = styles;
    }

    public InspectionRenderer() {
        this(new InspectionManager(), StyleRegistry.withDefaults());
    }

    /**
     * @throws StyleRegistry.UnknownStyleException before any inspection work when the style is unknown
     */
    public String render(String name, Object value, String styleName) {
        Style style = styles.get(styleName);
        Node root = manager.inspect(name, value);
        return style.render(TreeContextBuilder.build(root));
    }
}
