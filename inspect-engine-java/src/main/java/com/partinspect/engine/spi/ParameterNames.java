package com.partinspect.engine.spi;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort parameter name extraction.
 * Requires the -parameters javac flag; otherwise falls back to "arg0", "arg1", etc.
 */
public final class ParameterNames {

    private ParameterNames() {}

    public static List<String> of(Method method) {
        Parameter[] params = method.getParameters();
        List<String> names = new ArrayList<>(params.length);
        for (int i = 0; i < params.length; i++) {
            names.add(params[i].isNamePresent() ? params[i].getName() : "arg" + i);
        }
        return names;
    }
}
