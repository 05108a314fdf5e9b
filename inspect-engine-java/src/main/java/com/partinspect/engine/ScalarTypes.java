package com.partinspect.engine;

import java.util.Currency;
import java.util.Date;
import java.util.Set;
import java.util.UUID;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.time.temporal.TemporalAccessor;

/**
 * Decides which values are shown directly by their string form instead of being expanded.
 * Scalars are never tracked for cycles: equal-looking scalars may legitimately repeat.
 */
public final class ScalarTypes {

    private final Set<Class<?>> extra;

    public ScalarTypes(Set<Class<?>> extra) {
        this.extra = extra;
    }

    public boolean isScalar(Object value) {
        if (value == null) return true;
        Class<?> cls = value.getClass();
        if (isBuiltIn(cls)) return true;
        for (Class<?> type : extra) {
            if (type.isAssignableFrom(cls)) return true;
        }
        return false;
    }

    static boolean isBuiltIn(Class<?> cls) {
        return cls.isPrimitive()
            || CharSequence.class.isAssignableFrom(cls)
            || cls == Boolean.class
            || cls == Character.class
            || Number.class.isAssignableFrom(cls)
            || cls.isEnum()
            || Enum.class.isAssignableFrom(cls)
            || TemporalAccessor.class.isAssignableFrom(cls)
            || Date.class.isAssignableFrom(cls)
            || cls == Pattern.class
            || MatchResult.class.isAssignableFrom(cls)
            || cls == UUID.class
            || cls == Currency.class;
    }
}
