package com.partinspect.engine.context;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Render-engine-agnostic projection of one {@link com.partinspect.engine.Node}, handed to styles
 * and written as JSON.
 *
 * JSON schema:
 * {
 *   "title": "part",
 *   "id": 1,
 *   "type": "Part",
 *   "prefix": "{",
 *   "link_to": null,            // identity of the first occurrence, duplicates only
 *   "value": "",
 *   "postfix": "}",
 *   "total_children": 12,       // null for value-only nodes
 *   "inspect_type": "Composite",
 *   "children": [ ... ]         // null = not expanded, [] = expanded, empty
 * }
 */
public class TreeContext {

    @SerializedName("title")          public String title;
    @SerializedName("id")             public long id;
    @SerializedName("type")           public String type;
    @SerializedName("prefix")         public String prefix;
    @SerializedName("link_to")        public Long linkTo;
    @SerializedName("value")          public String value;
    @SerializedName("postfix")        public String postfix;
    @SerializedName("total_children") public Integer totalChildren;

    /** Variant tag, for troubleshooting the engine rather than for display. */
    @SerializedName("inspect_type")   public String inspectType;

    @SerializedName("children")       public List<TreeContext> children;

    /** Number of children omitted by the breadth budget. */
    public int moreCount() {
        if (children == null || totalChildren == null) return 0;
        return Math.max(0, totalChildren - children.size());
    }

    public boolean isDuplicate() {
        return linkTo != null;
    }
}
