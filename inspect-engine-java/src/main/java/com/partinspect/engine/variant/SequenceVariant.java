package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;

import java.lang.reflect.Array;
import java.util.Collection;

/**
 * Collections and arrays. Children are named by their index.
 */
public class SequenceVariant extends Variant {

    public SequenceVariant(String name, Object sequence) {
        super(name, sequence);
        if (!(sequence instanceof Collection<?>) && !sequence.getClass().isArray()) {
            throw new IllegalArgumentException("Not a collection or array: " + typeNameOf(sequence));
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEQUENCE;
    }

    @Override
    public String prefix() {
        return "[";
    }

    @Override
    public String postfix() {
        return "]";
    }

    @Override
    public Integer declaredChildCount() {
        if (value instanceof Collection<?> col) {
            return col.size();
        }
        return Array.getLength(value);
    }

    @Override
    public void expand(ChildSink sink, int maxItems) {
        if (value instanceof Collection<?> col) {
            int index = 0;
            for (Object elem : col) {
                if (index >= maxItems) break;
                sink.child(String.valueOf(index), elem);
                index++;
            }
            return;
        }
        int limit = Math.min(Array.getLength(value), maxItems);
        for (int i = 0; i < limit; i++) {
            sink.child(String.valueOf(i), Array.get(value, i));
        }
    }
}
