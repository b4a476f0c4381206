package com.jcomp.comprehension;

import com.jcomp.host.HostExpression;
import com.jcomp.host.HostStatement;
import com.jcomp.value.Scope;

/**
 * The innermost operation of a comprehension, run once per surviving iteration.
 */
public sealed interface AccumulationAction {

    void perform(Scope scope, Accumulator accumulator);

    record Push(HostExpression expr) implements AccumulationAction {
        @Override
        public void perform(Scope scope, Accumulator accumulator) {
            accumulator.append(expr.evaluate(scope));
        }
    }

    record Insert(HostExpression key, HostExpression value) implements AccumulationAction {
        @Override
        public void perform(Scope scope, Accumulator accumulator) {
            // Key first, then value, matching the order they are written
            var k = key.evaluate(scope);
            accumulator.insert(k, value.evaluate(scope));
        }
    }

    record Execute(HostStatement stmt) implements AccumulationAction {
        @Override
        public void perform(Scope scope, Accumulator accumulator) {
            stmt.execute(scope);
        }
    }
}
