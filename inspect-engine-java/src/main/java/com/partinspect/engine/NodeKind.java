package com.partinspect.engine;

/**
 * The fixed set of display variants a value can be classified into.
 */
public enum NodeKind {
    SCALAR("Scalar"),
    BOUND_METHOD("BoundMethod"),
    PARTIAL_CALL("PartialCall"),
    MAPPING("Mapping"),
    SEQUENCE("Sequence"),
    LAZY_COLLECTION("LazyCollection"),
    COMPOSITE("Composite"),
    DUPLICATE("Duplicate");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /** Diagnostic name of the variant, used when troubleshooting the engine itself. */
    public String tag() {
        return tag;
    }

    /** True for variants that hold child nodes when expanded. */
    public boolean isContainer() {
        return this == MAPPING || this == SEQUENCE || this == LAZY_COLLECTION || this == COMPOSITE;
    }
}
