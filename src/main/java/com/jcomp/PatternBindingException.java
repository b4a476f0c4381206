package com.jcomp;

import com.jcomp.value.Value;
import com.jcomp.value.Values;

public class PatternBindingException extends EvaluationException {

    private final String pattern;
    private final Value value;

    public PatternBindingException(String pattern, Value value, String reason) {
        super("Cannot bind " + Values.show(value) + " to pattern '" + pattern + "': " + reason);
        this.pattern = pattern;
        this.value = value;
    }

    public String getPattern() {
        return pattern;
    }

    public Value getValue() {
        return value;
    }
}
