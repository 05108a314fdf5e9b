package com.partinspect.engine.spi;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Objects;

/**
 * A public instance method paired with the receiver it will be invoked on.
 */
public final class BoundMethod {

    private final Object receiver;
    private final Method method;

    public BoundMethod(Object receiver, Method method) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.method = Objects.requireNonNull(method, "method");
        if (Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException("Static method cannot be bound: " + method);
        }
        if (!method.getDeclaringClass().isInstance(receiver)) {
            throw new IllegalArgumentException(
                method.getDeclaringClass().getName() + "::" + method.getName()
                    + " cannot be bound to " + receiver.getClass().getName());
        }
    }

    /** Binds the first public method named {@code name} with the given arity. */
    public static BoundMethod of(Object receiver, String name, int arity) {
        for (Method m : receiver.getClass().getMethods()) {
            if (m.getName().equals(name) && m.getParameterCount() == arity
                    && !Modifier.isStatic(m.getModifiers())) {
                return new BoundMethod(receiver, m);
            }
        }
        throw new IllegalArgumentException(
            "No public method " + name + "/" + arity + " on " + receiver.getClass().getName());
    }

    public Object receiver() { return receiver; }
    public Method method()   { return method; }
    public String name()     { return method.getName(); }

    public List<String> parameterNames() {
        return ParameterNames.of(method);
    }

    public Object invoke(Object... args) throws InvocationTargetException, IllegalAccessException {
        method.trySetAccessible();
        return method.invoke(receiver, args);
    }

    @Override
    public String toString() {
        return receiver.getClass().getSimpleName() + "::" + method.getName()
            + "(" + String.join(", ", parameterNames()) + ")";
    }
}
