package com.partinspect.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Budgets and classification settings for {@link InspectionManager}.
 */
public class InspectConfig {

    /** Levels of children to expand below the inspected root. */
    public final int maxDepth;

    /** Maximum entries expanded per mapping, sequence or lazy collection. */
    public final int maxItems;

    /** Types rendered as scalars in addition to the built-in ones (e.g. a money type). */
    public final Set<Class<?>> scalarTypes;

    /** Scalars whose name contains this fragment (ignoring case) are masked. */
    public final String maskedNameFragment;

    public InspectConfig(int maxDepth, int maxItems) {
        this(maxDepth, maxItems, Collections.emptySet(), "password");
    }

    public InspectConfig(int maxDepth, int maxItems, Set<Class<?>> scalarTypes, String maskedNameFragment) {
        requireBudget("maxDepth", maxDepth);
        requireBudget("maxItems", maxItems);
        if (maskedNameFragment == null || maskedNameFragment.isEmpty()) {
            throw new IllegalArgumentException("maskedNameFragment must not be empty");
        }
        this.maxDepth = maxDepth;
        this.maxItems = maxItems;
        this.scalarTypes = Collections.unmodifiableSet(new LinkedHashSet<>(scalarTypes));
        this.maskedNameFragment = maskedNameFragment;
    }

    public static InspectConfig defaults() {
        return new InspectConfig(2, 5);
    }

    public InspectConfig withBudgets(int maxDepth, int maxItems) {
        return new InspectConfig(maxDepth, maxItems, scalarTypes, maskedNameFragment);
    }

    public InspectConfig withScalarType(Class<?> type) {
        Set<Class<?>> types = new LinkedHashSet<>(scalarTypes);
        types.add(type);
        return new InspectConfig(maxDepth, maxItems, types, maskedNameFragment);
    }

    public InspectConfig withMaskedNameFragment(String fragment) {
        return new InspectConfig(maxDepth, maxItems, scalarTypes, fragment);
    }

    static void requireBudget(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was " + value);
        }
    }
}
