package com.jcomp.host;

import com.jcomp.value.Scope;

@FunctionalInterface
public interface HostStatement {
    void execute(Scope scope);
}
