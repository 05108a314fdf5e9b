package com.partinspect.engine.spi;

/**
 * Explicit field enumeration for composite objects. When a value implements this interface its
 * attributes are taken from {@link #exposeAttributes} instead of reflection.
 *
 * <pre>
 *   public AttributeCollector exposeAttributes(AttributeCollector c) {
 *       return super.exposeAttributes(c).add("name", name).addComputed("stock", this::totalStock);
 *   }
 * </pre>
 */
public interface Inspectable {

    AttributeCollector exposeAttributes(AttributeCollector collector);
}
