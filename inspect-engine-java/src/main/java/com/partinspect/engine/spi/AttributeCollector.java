package com.partinspect.engine.spi;

import java.util.concurrent.Callable;

/**
 * Receives the named attributes an {@link Inspectable} chooses to expose.
 * Returns itself so calls can be chained.
 */
public interface AttributeCollector {

    AttributeCollector add(String name, Object value);

    /** Adds an attribute whose value is read only when the attribute is expanded. */
    AttributeCollector addComputed(String name, Callable<?> reader);
}
