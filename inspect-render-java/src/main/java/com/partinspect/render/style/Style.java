package com.partinspect.render.style;

import com.partinspect.engine.context.TreeContext;

/**
 * A named presentation of an inspection tree.
 *
 * Implementations must treat {@code children == null} (not expanded) and an empty list
 * (expanded, nothing inside) differently, link duplicates through {@code link_to}, and compute
 * "N more" from {@code total_children}, never from the size of the child list.
 */
public interface Style {

    String name();

    String render(TreeContext root);
}
