package com.jcomp.value;

import com.jcomp.EvaluationException;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.io.PrintStream;
import java.util.LinkedHashMap;

/**
 * Chained variable table. Each {@code for} iteration evaluates in a child of the scope that
 * encloses it, so loop variables shadow outer ones while assignments still reach outer
 * variables.
 */
public final class Scope {
    private final Scope parent;
    private final PrintStream out;
    private final MutableMap<String, Value> variables = MapAdapter.adapt(new LinkedHashMap<>());

    public Scope() {
        this(System.out);
    }

    public Scope(PrintStream out) {
        this(null, out);
    }

    private Scope(Scope parent, PrintStream out) {
        this.parent = parent;
        this.out = out;
    }

    public Scope child() {
        return new Scope(this, out);
    }

    public Scope define(String name, Value value) {
        variables.put(name, value);
        return this;
    }

    public boolean isDefined(String name) {
        return variables.containsKey(name) || (parent != null && parent.isDefined(name));
    }

    public Value lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Value value = scope.variables.get(name);
            if (value != null) {
                return value;
            }
        }
        throw new EvaluationException("Unknown variable '" + name + "'");
    }

    /**
     * Rebinds the nearest existing variable named {@code name}.
     */
    public void assign(String name, Value value) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                scope.variables.put(name, value);
                return;
            }
        }
        throw new EvaluationException("Cannot assign to undeclared variable '" + name + "'");
    }

    /**
     * Variables declared directly in this scope, in declaration order.
     */
    public MutableMap<String, Value> variables() {
        return variables.asUnmodifiable();
    }

    public PrintStream out() {
        return out;
    }
}
