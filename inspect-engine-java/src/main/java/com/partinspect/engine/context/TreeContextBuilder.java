package com.partinspect.engine.context;

import com.partinspect.engine.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies a {@link Node} tree into {@link TreeContext} objects. Makes no traversal decisions.
 */
public final class TreeContextBuilder {

    private TreeContextBuilder() {}

    public static TreeContext build(Node node) {
        TreeContext ctx = new TreeContext();
        ctx.title = node.title();
        ctx.id = node.identity();
        ctx.type = node.typeName();
        ctx.prefix = node.prefix();
        ctx.linkTo = node.linkTo();
        ctx.value = node.valueText();
        ctx.postfix = node.postfix();
        ctx.totalChildren = node.declaredChildCount();
        ctx.inspectType = node.kind().tag();

        if (node.children() != null) {
            List<TreeContext> children = new ArrayList<>(node.children().size());
            for (Node child : node.children()) {
                children.add(build(child));
            }
            ctx.children = children;
        }
        return ctx;
    }
}
