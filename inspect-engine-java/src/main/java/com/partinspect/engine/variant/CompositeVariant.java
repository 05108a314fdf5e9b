package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;

import java.util.List;

/**
 * Fallback for any object: one child per public attribute. Not subject to the breadth budget.
 *
 * Before expansion the declared count is the number of attributes found by enumeration; after
 * expansion it is the number of children actually produced, since values dropped on read
 * (type objects, {@link com.partinspect.engine.spi.DoNotInvoke} values) are not children.
 */
public class CompositeVariant extends Variant {

    private final List<CompositeAttributes.Attribute> attributes;
    private int produced = -1;

    public CompositeVariant(String name, Object obj) {
        super(name, obj);
        this.attributes = CompositeAttributes.of(obj);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPOSITE;
    }

    @Override
    public String prefix() {
        return "{";
    }

    @Override
    public String postfix() {
        return "}";
    }

    @Override
    public Integer declaredChildCount() {
        return produced >= 0 ? produced : attributes.size();
    }

    @Override
    public void expand(ChildSink sink, int maxItems) {
        int count = 0;
        for (CompositeAttributes.Attribute attr : attributes) {
            Object attrValue;
            try {
                attrValue = attr.reader().call();
            } catch (Exception e) {
                sink.failed(attr.name(), e);
                count++;
                continue;
            }
            if (CompositeAttributes.isHiddenValue(attrValue)) continue;
            sink.child(attr.name(), attrValue);
            count++;
        }
        produced = count;
    }
}
