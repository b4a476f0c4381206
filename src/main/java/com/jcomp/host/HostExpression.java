package com.jcomp.host;

import com.jcomp.value.Scope;
import com.jcomp.value.Value;

@FunctionalInterface
public interface HostExpression {
    Value evaluate(Scope scope);
}
