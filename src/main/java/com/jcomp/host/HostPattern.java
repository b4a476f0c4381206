package com.jcomp.host;

import com.jcomp.value.Scope;
import com.jcomp.value.Value;

@FunctionalInterface
public interface HostPattern {

    /**
     * Declares the pattern's variables in {@code scope}.
     *
     * @throws com.jcomp.PatternBindingException if the value does not match the pattern
     */
    void bind(Value value, Scope scope);
}
