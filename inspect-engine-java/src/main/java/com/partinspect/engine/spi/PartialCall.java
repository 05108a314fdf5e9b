package com.partinspect.engine.spi;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A bound method with some of its arguments supplied up front.
 *
 * Positional arguments fill the leading parameters; named arguments fill parameters by name.
 * Arguments given to {@link #invoke(Object...)} fill the remaining parameters in order.
 */
public final class PartialCall {

    private final BoundMethod target;
    private final List<Object> positional;
    private final Map<String, Object> named;

    private PartialCall(BoundMethod target, List<Object> positional, Map<String, Object> named) {
        this.target = target;
        this.positional = positional;
        this.named = named;
    }

    public static PartialCall of(BoundMethod target, Object... positional) {
        Objects.requireNonNull(target, "target");
        int arity = target.method().getParameterCount();
        if (positional.length > arity) {
            throw new IllegalArgumentException(
                target.name() + " takes " + arity + " arguments, " + positional.length + " bound");
        }
        return new PartialCall(target,
            Collections.unmodifiableList(new ArrayList<>(Arrays.asList(positional))),
            Collections.emptyMap());
    }

    /** Returns a copy with {@code parameterName} additionally bound to {@code value}. */
    public PartialCall with(String parameterName, Object value) {
        List<String> names = target.parameterNames();
        int index = names.indexOf(parameterName);
        if (index < 0) {
            throw new IllegalArgumentException(target.name() + " has no parameter " + parameterName);
        }
        if (index < positional.size()) {
            throw new IllegalArgumentException(parameterName + " is already bound positionally");
        }
        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(parameterName, value);
        return new PartialCall(target, positional, Collections.unmodifiableMap(copy));
    }

    public BoundMethod target()                { return target; }
    public List<Object> positionalArguments()  { return positional; }
    public Map<String, Object> namedArguments() { return named; }

    public Object invoke(Object... remaining) throws InvocationTargetException, IllegalAccessException {
        List<String> names = target.parameterNames();
        Object[] args = new Object[names.size()];
        int next = 0;
        for (int i = 0; i < args.length; i++) {
            if (i < positional.size()) {
                args[i] = positional.get(i);
            } else if (named.containsKey(names.get(i))) {
                args[i] = named.get(names.get(i));
            } else if (next < remaining.length) {
                args[i] = remaining[next++];
            } else {
                throw new IllegalArgumentException("Missing argument for " + names.get(i));
            }
        }
        if (next < remaining.length) {
            throw new IllegalArgumentException(
                (remaining.length - next) + " surplus argument(s) for " + target.name());
        }
        return target.invoke(args);
    }

    @Override
    public String toString() {
        return "partial(" + target + ")";
    }
}
