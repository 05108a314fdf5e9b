package com.partinspect.engine;

import com.partinspect.engine.spi.BoundMethod;
import com.partinspect.engine.spi.LazyCollection;
import com.partinspect.engine.spi.PartialCall;
import com.partinspect.engine.variant.BoundMethodVariant;
import com.partinspect.engine.variant.CompositeVariant;
import com.partinspect.engine.variant.LazyCollectionVariant;
import com.partinspect.engine.variant.MappingVariant;
import com.partinspect.engine.variant.PartialCallVariant;
import com.partinspect.engine.variant.ScalarVariant;
import com.partinspect.engine.variant.SequenceVariant;
import com.partinspect.engine.variant.Variant;

import java.util.Collection;
import java.util.Map;

/**
 * Maps a runtime value to exactly one {@link Variant}. First match wins:
 * scalar, bound method, partial call, map, collection or array, lazy collection, composite.
 *
 * Scalars are tested first so that values which also satisfy a broader shape are never expanded.
 * {@link NodeKind#DUPLICATE} is never chosen here; the traversal substitutes it.
 */
public final class NodeClassifier {

    private final ScalarTypes scalars;
    private final String maskedNameFragment;

    public NodeClassifier(InspectConfig config) {
        this.scalars = new ScalarTypes(config.scalarTypes);
        this.maskedNameFragment = config.maskedNameFragment;
    }

    public boolean isScalar(Object value) {
        return scalars.isScalar(value);
    }

    public Variant classify(String name, Object value) {
        if (scalars.isScalar(value)) {
            return new ScalarVariant(name, value, maskedNameFragment);
        }
        if (value instanceof BoundMethod method) {
            return new BoundMethodVariant(name, method);
        }
        if (value instanceof PartialCall call) {
            return new PartialCallVariant(name, call, scalars);
        }
        if (value instanceof Map<?, ?> map) {
            return new MappingVariant(name, map);
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return new SequenceVariant(name, value);
        }
        if (value instanceof LazyCollection<?> lazy) {
            return new LazyCollectionVariant(name, lazy);
        }
        return new CompositeVariant(name, value);
    }
}
