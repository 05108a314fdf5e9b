package com.partinspect.engine.variant;

import com.partinspect.engine.spi.AttributeCollector;
import com.partinspect.engine.spi.BoundMethod;
import com.partinspect.engine.spi.DoNotInvoke;
import com.partinspect.engine.spi.Inspectable;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Enumerates the public attributes of an arbitrary object.
 *
 * Rules:
 * - {@link Inspectable} objects supply their own attributes, in their own order
 * - otherwise, by name: record components, bean accessors (getX / isX), public instance fields,
 *   then every other public instance method as a {@link BoundMethod}
 * - skipped: static members, names starting with '_' or '$', methods declared by or overriding
 *   {@link Object}, members or value types marked {@link DoNotInvoke}, Class-typed members
 * - values are read lazily; Class values and {@link DoNotInvoke} values are dropped on read
 */
final class CompositeAttributes {

    private CompositeAttributes() {}

    /** A named attribute whose value is read on demand. */
    record Attribute(String name, Callable<?> reader) {}

    private static final Set<String> OBJECT_METHODS = new HashSet<>();

    static {
        for (Method m : Object.class.getMethods()) {
            OBJECT_METHODS.add(signature(m));
        }
    }

    static List<Attribute> of(Object obj) {
        if (obj instanceof Inspectable inspectable) {
            return fromInspectable(inspectable);
        }
        return fromReflection(obj);
    }

    /** True when a value read from an attribute must not be shown. */
    static boolean isHiddenValue(Object value) {
        return value instanceof Class<?>
            || value != null && value.getClass().isAnnotationPresent(DoNotInvoke.class);
    }

    private static List<Attribute> fromInspectable(Inspectable inspectable) {
        Map<String, Attribute> attrs = new LinkedHashMap<>();
        inspectable.exposeAttributes(new AttributeCollector() {
            @Override
            public AttributeCollector add(String name, Object value) {
                if (isVisibleName(name) && !isHiddenValue(value)) {
                    attrs.putIfAbsent(name, new Attribute(name, () -> value));
                }
                return this;
            }

            @Override
            public AttributeCollector addComputed(String name, Callable<?> reader) {
                if (isVisibleName(name)) {
                    attrs.putIfAbsent(name, new Attribute(name, reader));
                }
                return this;
            }
        });
        return new ArrayList<>(attrs.values());
    }

    private static List<Attribute> fromReflection(Object obj) {
        Class<?> cls = obj.getClass();
        Map<String, Attribute> properties = new TreeMap<>();
        Map<String, Attribute> methods = new TreeMap<>();
        Set<Method> claimed = new HashSet<>();

        if (cls.isRecord()) {
            for (RecordComponent rc : cls.getRecordComponents()) {
                Method accessor = rc.getAccessor();
                claimed.add(accessor);
                if (isVisibleMember(rc.getName(), accessor) && isVisibleType(rc.getType())) {
                    properties.putIfAbsent(rc.getName(), new Attribute(rc.getName(), invoking(obj, accessor)));
                }
            }
        }

        Method[] publicMethods = cls.getMethods();
        Arrays.sort(publicMethods, Comparator.comparing(Method::getName)
            .thenComparingInt(Method::getParameterCount));

        for (Method m : publicMethods) {
            if (claimed.contains(m) || !isCandidate(m)) continue;
            String property = propertyName(m);
            if (property != null) {
                claimed.add(m);
                if (isVisibleMember(property, m) && isVisibleType(m.getReturnType())) {
                    properties.putIfAbsent(property, new Attribute(property, invoking(obj, m)));
                }
            }
        }

        for (Field f : cls.getFields()) {
            if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) continue;
            if (isVisibleMember(f.getName(), f) && isVisibleType(f.getType())) {
                properties.putIfAbsent(f.getName(), new Attribute(f.getName(), reading(obj, f)));
            }
        }

        for (Method m : publicMethods) {
            if (claimed.contains(m) || !isCandidate(m)) continue;
            if (isVisibleMember(m.getName(), m) && !properties.containsKey(m.getName())) {
                BoundMethod bound = new BoundMethod(obj, m);
                methods.putIfAbsent(m.getName(), new Attribute(m.getName(), () -> bound));
            }
        }

        // properties and methods share one name space, ordered by name
        Map<String, Attribute> all = new TreeMap<>(methods);
        all.putAll(properties);
        return new ArrayList<>(all.values());
    }

    private static boolean isCandidate(Method m) {
        return !Modifier.isStatic(m.getModifiers())
            && !m.isBridge()
            && !m.isSynthetic()
            && !OBJECT_METHODS.contains(signature(m));
    }

    private static boolean isVisibleMember(String name, AnnotatedElement member) {
        return isVisibleName(name) && !member.isAnnotationPresent(DoNotInvoke.class);
    }

    private static boolean isVisibleType(Class<?> type) {
        return type != Class.class && !type.isAnnotationPresent(DoNotInvoke.class);
    }

    private static boolean isVisibleName(String name) {
        return name != null && !name.isEmpty() && !name.startsWith("_") && !name.startsWith("$");
    }

    /** Returns the bean property name for an accessor, or null if {@code m} is not one. */
    static String propertyName(Method m) {
        if (m.getParameterCount() != 0 || m.getReturnType() == void.class) return null;
        String n = m.getName();
        if (n.startsWith("get") && n.length() > 3 && Character.isUpperCase(n.charAt(3))) {
            return decapitalize(n.substring(3));
        }
        if (n.startsWith("is") && n.length() > 2 && Character.isUpperCase(n.charAt(2))
                && (m.getReturnType() == boolean.class || m.getReturnType() == Boolean.class)) {
            return decapitalize(n.substring(2));
        }
        return null;
    }

    private static String decapitalize(String s) {
        // "URL" stays "URL", "Name" becomes "name"
        if (s.length() > 1 && Character.isUpperCase(s.charAt(1))) return s;
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }

    private static Callable<?> invoking(Object obj, Method m) {
        return () -> {
            m.trySetAccessible();
            try {
                return m.invoke(obj);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) throw ex;
                throw e;
            }
        };
    }

    private static Callable<?> reading(Object obj, Field f) {
        return () -> {
            f.trySetAccessible();
            return f.get(obj);
        };
    }

    private static String signature(Method m) {
        return m.getName() + Arrays.toString(m.getParameterTypes());
    }
}
