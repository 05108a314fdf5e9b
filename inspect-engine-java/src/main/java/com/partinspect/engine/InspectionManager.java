package com.partinspect.engine;

import com.partinspect.engine.variant.ChildSink;
import com.partinspect.engine.variant.Variant;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * Builds a bounded, cycle-safe {@link Node} tree for an arbitrary object.
 *
 * Rules:
 * - Depth: {@code maxDepth} levels of children are expanded below the root. A container reached
 *   with no depth left keeps its kind, title and declared count but has null children
 * - Breadth: at most {@code maxItems} children per map, collection, array or lazy collection;
 *   composites list every attribute
 * - Cycles: every non-scalar value is registered by identity before its children are classified;
 *   a value met again becomes a {@link NodeKind#DUPLICATE} node linking to the first occurrence
 * - Attribute read failures become "[Error: ...]" leaves; siblings are unaffected
 *
 * Each {@link #inspect} call uses its own visited set, discarded when the call returns. A manager
 * holds no other state, but a single call is not meant to be shared between threads.
 */
public class InspectionManager {

    static final String DUPLICATED = "(duplicated)";

    private final InspectConfig config;
    private final NodeClassifier classifier;

    public InspectionManager(InspectConfig config) {
        this.config = config;
        this.classifier = new NodeClassifier(config);
    }

    public InspectionManager() {
        this(InspectConfig.defaults());
    }

    public Node inspect(String name, Object value) {
        return inspect(name, value, config.maxDepth, config.maxItems);
    }

    public Node inspect(String name, Object value, int maxDepth, int maxItems) {
        InspectConfig.requireBudget("maxDepth", maxDepth);
        InspectConfig.requireBudget("maxItems", maxItems);
        // the root itself is classified with one extra unit: depth counts generations of children
        int budget = maxDepth == Integer.MAX_VALUE ? maxDepth : maxDepth + 1;
        return new Traversal(maxItems).classify(name, value, budget);
    }

    /** Classifies with a raw depth budget; the budget must be at least 1. */
    Node classify(String name, Object value, int depthBudget, int maxItems) {
        return new Traversal(maxItems).classify(name, value, depthBudget);
    }

    /**
     * Classification was asked for with no depth budget left: a defect in the traversal itself,
     * never a property of the inspected data.
     */
    public static class InspectionStateException extends IllegalStateException {
        public InspectionStateException(String message) { super(message); }
    }

    /** One inspection run. Owns the visited set and the identity counter. */
    private final class Traversal {

        private final IdentityHashMap<Object, Long> visited = new IdentityHashMap<>();
        private final int maxItems;
        private long nextId = 1;

        Traversal(int maxItems) {
            this.maxItems = maxItems;
        }

        /**
         * @param depthBudget 1 + the number of child generations still allowed
         */
        Node classify(String name, Object value, int depthBudget) {
            if (depthBudget <= 0) {
                throw new InspectionStateException(
                    "Internal error in InspectionManager: depth exceeded at '" + name + "'");
            }

            Variant variant = classifier.classify(name, value);
            long id = nextId++;
            if (variant.kind() != NodeKind.SCALAR) {
                visited.put(value, id);
            }

            List<Node> children = null;
            int remaining = depthBudget - 1;
            if (variant.kind().isContainer() && remaining > 0) {
                List<Node> expanded = new ArrayList<>();
                variant.expand(new ChildSink() {
                    @Override
                    public void child(String childName, Object childValue) {
                        expanded.add(childNode(childName, childValue, remaining));
                    }

                    @Override
                    public void failed(String childName, Throwable error) {
                        expanded.add(errorNode(childName, error));
                    }
                }, maxItems);
                children = expanded;
            }

            return new Node(
                id,
                variant.kind(),
                variant.title(),
                variant.typeName(),
                variant.valueText(),
                variant.prefix(),
                variant.postfix(),
                variant.declaredChildCount(),
                children,
                null);
        }

        private Node childNode(String name, Object value, int depthBudget) {
            if (!classifier.isScalar(value)) {
                Long seen = visited.get(value);
                if (seen != null) {
                    return duplicateNode(name, value, seen);
                }
            }
            return classify(name, value, depthBudget);
        }

        private Node duplicateNode(String name, Object value, long firstSeen) {
            return new Node(
                firstSeen,
                NodeKind.DUPLICATE,
                name,
                Variant.typeNameOf(value),
                DUPLICATED,
                "",
                "",
                null,
                null,
                firstSeen);
        }

        private Node errorNode(String name, Throwable error) {
            Throwable cause = error instanceof InvocationTargetException && error.getCause() != null
                ? error.getCause()
                : error;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
            return new Node(
                nextId++,
                NodeKind.SCALAR,
                name,
                cause.getClass().getSimpleName(),
                "[Error: " + message + "]",
                "=",
                "",
                null,
                null,
                null);
        }
    }
}
