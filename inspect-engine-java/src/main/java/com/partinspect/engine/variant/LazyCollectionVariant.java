package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;
import com.partinspect.engine.spi.LazyCollection;

import java.util.List;

/**
 * Deferred collections. The size comes from a single count query and only the first
 * {@code maxItems} elements are ever fetched.
 */
public class LazyCollectionVariant extends Variant {

    private final LazyCollection<?> collection;
    private Long count;

    public LazyCollectionVariant(String name, LazyCollection<?> collection) {
        super(name, collection);
        this.collection = collection;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAZY_COLLECTION;
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
        return clamp(count());
    }

    @Override
    public void expand(ChildSink sink, int maxItems) {
        if (count() <= 0 || maxItems <= 0) return;
        List<?> items = collection.take(maxItems);
        int limit = (int) Math.min(Math.min(items.size(), maxItems), count());
        for (int i = 0; i < limit; i++) {
            sink.child(String.valueOf(i), items.get(i));
        }
    }

    private long count() {
        if (count == null) {
            count = collection.count();
        }
        return count;
    }
}
