package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;

import java.util.Map;

/**
 * Key/value maps. One child per entry in iteration order, keyed by {@code String.valueOf(key)}.
 */
public class MappingVariant extends Variant {

    private final Map<?, ?> map;

    public MappingVariant(String name, Map<?, ?> map) {
        super(name, map);
        this.map = map;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAPPING;
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
        return map.size();
    }

    @Override
    public void expand(ChildSink sink, int maxItems) {
        int count = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (count >= maxItems) break;
            sink.child(String.valueOf(entry.getKey()), entry.getValue());
            count++;
        }
    }
}
