package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;
import com.partinspect.engine.ScalarTypes;
import com.partinspect.engine.spi.PartialCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A partially applied call. Parameters the partial supplies are shown as {@code name=value}
 * (or {@code name=(complex)} when the value is not a scalar); the rest by bare name.
 */
public class PartialCallVariant extends Variant {

    static final String COMPLEX = "(complex)";

    private final PartialCall call;
    private final ScalarTypes scalars;

    public PartialCallVariant(String name, PartialCall call, ScalarTypes scalars) {
        super(name, call);
        this.call = call;
        this.scalars = scalars;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARTIAL_CALL;
    }

    @Override
    public String title() {
        return name + "(...) -> " + call.target().name();
    }

    @Override
    public String valueText() {
        List<String> names = call.target().parameterNames();
        List<Object> positional = call.positionalArguments();
        Map<String, Object> named = call.namedArguments();

        List<String> fragments = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String param = names.get(i);
            if (i < positional.size()) {
                fragments.add(bound(param, positional.get(i)));
            } else if (named.containsKey(param)) {
                fragments.add(bound(param, named.get(param)));
            } else {
                fragments.add(param);
            }
        }
        return String.join(", ", fragments);
    }

    private String bound(String param, Object argument) {
        return param + "=" + (scalars.isScalar(argument) ? String.valueOf(argument) : COMPLEX);
    }

    @Override
    public String prefix() {
        return "(";
    }

    @Override
    public String postfix() {
        return ")";
    }
}
