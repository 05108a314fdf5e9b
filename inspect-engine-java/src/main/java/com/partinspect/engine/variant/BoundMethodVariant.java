package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;
import com.partinspect.engine.spi.BoundMethod;

/**
 * A method bound to its receiver, shown as {@code name(param1, param2)}.
 */
public class BoundMethodVariant extends Variant {

    private final BoundMethod method;

    public BoundMethodVariant(String name, BoundMethod method) {
        super(name, method);
        this.method = method;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOUND_METHOD;
    }

    @Override
    public String valueText() {
        return String.join(", ", method.parameterNames());
    }

    @Override
    public String prefix() {
        return "(";
    }

    @Override
    public String postfix() {
        return ")";
    }
}
