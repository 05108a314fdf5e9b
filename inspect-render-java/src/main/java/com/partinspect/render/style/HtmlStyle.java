package com.partinspect.render.style;

import com.partinspect.engine.context.TreeContext;

/**
 * Nested HTML lists. Each expanded node carries an {@code inspect-<id>} anchor and duplicates
 * link back to it.
 */
public class HtmlStyle implements Style {

    static final String ANCHOR_PREFIX = "inspect-";

    @Override
    public String name() {
        return "html";
    }

    @Override
    public String render(TreeContext root) {
        StringBuilder sb = new StringBuilder("<div class=\"inspect\">\n<ul>\n");
        append(sb, root);
        sb.append("</ul>\n</div>\n");
        return sb.toString();
    }

    private void append(StringBuilder sb, TreeContext node) {
        if (node.isDuplicate()) {
            sb.append("<li class=\"duplicate\">").append(title(node)).append(" <a href=\"#")
              .append(ANCHOR_PREFIX).append(node.linkTo).append("\">").append(escape(node.value))
              .append("</a></li>\n");
            return;
        }

        sb.append("<li id=\"").append(ANCHOR_PREFIX).append(node.id).append("\" data-inspect-type=\"")
          .append(escape(node.inspectType)).append("\">").append(title(node)).append(' ');

        if (node.totalChildren == null) {
            sb.append("<span class=\"prefix\">").append(escape(node.prefix)).append("</span>")
              .append("<span class=\"value\">").append(escape(node.value)).append("</span>")
              .append("<span class=\"postfix\">").append(escape(node.postfix)).append("</span></li>\n");
            return;
        }

        sb.append(escape(node.prefix));
        if (node.children == null) {
            sb.append(" <span class=\"elided\">... ").append(node.totalChildren).append("</span> ")
              .append(escape(node.postfix)).append("</li>\n");
            return;
        }
        if (!node.children.isEmpty() || node.moreCount() > 0) {
            sb.append("\n<ul>\n");
            for (TreeContext child : node.children) {
                append(sb, child);
            }
            if (node.moreCount() > 0) {
                sb.append("<li class=\"more\">... ").append(node.moreCount()).append(" more</li>\n");
            }
            sb.append("</ul>\n");
        } else {
            sb.append(' ');
        }
        sb.append(escape(node.postfix)).append("</li>\n");
    }

    private static String title(TreeContext node) {
        return "<span class=\"title\">" + escape(node.title) + "</span> <span class=\"type\">"
            + escape(node.type) + "</span>";
    }

    static String escape(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
