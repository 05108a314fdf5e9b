package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;

import java.util.Locale;

/**
 * Strings, numbers, dates and other values shown by their string form.
 * Values whose name contains the masked fragment are shown as a quoted run of '*'.
 */
public class ScalarVariant extends Variant {

    private final String maskedNameFragment;

    public ScalarVariant(String name, Object value, String maskedNameFragment) {
        super(name, value);
        this.maskedNameFragment = maskedNameFragment.toLowerCase(Locale.ROOT);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SCALAR;
    }

    @Override
    public String valueText() {
        String text = String.valueOf(value);
        if (isMasked()) {
            return '"' + "*".repeat(text.codePointCount(0, text.length())) + '"';
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return '"' + text + '"';
        }
        return text;
    }

    @Override
    public String prefix() {
        return "=";
    }

    boolean isMasked() {
        return name != null && name.toLowerCase(Locale.ROOT).contains(maskedNameFragment);
    }
}
