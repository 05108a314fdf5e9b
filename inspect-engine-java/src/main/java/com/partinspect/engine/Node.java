package com.partinspect.engine;

import java.util.List;
import java.util.Objects;

/**
 * One classified value in an inspection tree. Immutable once built.
 *
 * {@code children} is null when no expansion was attempted (value-only variants, duplicates and
 * containers reached with the depth budget exhausted); an empty list means the container was
 * expanded and holds nothing. {@code declaredChildCount} is the true size of the underlying
 * container and is null for value-only variants.
 *
 * @param identity           per-traversal handle of the underlying object
 * @param kind               the variant
 * @param title              display name, normally the field, key or index
 * @param typeName           simple type name of the value
 * @param valueText          display text for value variants, empty for containers
 * @param prefix             decoration before the value or child list
 * @param postfix            decoration after the value or child list
 * @param declaredChildCount true number of children, may exceed {@code children.size()}
 * @param children           expanded children, or null
 * @param linkTo             identity of the first occurrence, only for duplicates
 */
public record Node(
    long identity,
    NodeKind kind,
    String title,
    String typeName,
    String valueText,
    String prefix,
    String postfix,
    Integer declaredChildCount,
    List<Node> children,
    Long linkTo
) {

    public Node {
        Objects.requireNonNull(kind, "kind");
        children = children == null ? null : List.copyOf(children);
        if (children != null && (declaredChildCount == null || declaredChildCount < children.size())) {
            throw new IllegalArgumentException(
                "declaredChildCount " + declaredChildCount + " < " + children.size() + " children");
        }
        if (kind == NodeKind.DUPLICATE && (children != null || linkTo == null)) {
            throw new IllegalArgumentException("Duplicate node must link and carry no children");
        }
    }

    /** True when the container was expanded (possibly to zero children). */
    public boolean isExpanded() {
        return children != null;
    }

    /** Number of children left out by the breadth budget; 0 when not expanded. */
    public int omittedChildCount() {
        if (children == null || declaredChildCount == null) return 0;
        return declaredChildCount - children.size();
    }
}
