package com.partinspect.render.style;

import com.partinspect.engine.context.TreeContext;

/**
 * Indented plain text, one node per line.
 *
 * <pre>
 * part #1 (Part) {
 *     name = "R1" (String)
 *     split(quantity, location) (BoundMethod)
 *     parameters #4 (ArrayList) [ ... 3 ]
 *     category #5 (Category) {
 *         parts #6 (ArrayList) [
 *             0 -> #1 (duplicated)
 *             ... 2 more
 *         ]
 *     }
 * }
 * </pre>
 */
public class TextStyle implements Style {

    private static final String INDENT = "    ";

    @Override
    public String name() {
        return "text";
    }

    @Override
    public String render(TreeContext root) {
        StringBuilder sb = new StringBuilder();
        append(sb, root, 0);
        return sb.toString();
    }

    private void append(StringBuilder sb, TreeContext node, int level) {
        String indent = INDENT.repeat(level);
        sb.append(indent);

        if (node.isDuplicate()) {
            sb.append(node.title).append(" -> #").append(node.linkTo).append(' ').append(node.value).append('\n');
            return;
        }

        if (node.totalChildren == null) {
            sb.append(node.title);
            if ("=".equals(node.prefix)) {
                sb.append(" = ").append(node.value);
            } else {
                sb.append(node.prefix).append(node.value).append(node.postfix);
            }
            sb.append(" (").append(node.type).append(")\n");
            return;
        }

        sb.append(node.title).append(" #").append(node.id).append(" (").append(node.type).append(") ");
        if (node.children == null) {
            sb.append(node.prefix).append(" ... ").append(node.totalChildren).append(' ')
              .append(node.postfix).append('\n');
            return;
        }
        if (node.children.isEmpty() && node.moreCount() == 0) {
            sb.append(node.prefix).append(' ').append(node.postfix).append('\n');
            return;
        }
        sb.append(node.prefix).append('\n');
        for (TreeContext child : node.children) {
            append(sb, child, level + 1);
        }
        if (node.moreCount() > 0) {
            sb.append(indent).append(INDENT).append("... ").append(node.moreCount()).append(" more\n");
        }
        sb.append(indent).append(node.postfix).append('\n');
    }
}
