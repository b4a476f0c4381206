package com.jcomp.comprehension;

import com.jcomp.value.Scope;

/**
 * One executable level of a lowered comprehension.
 */
@FunctionalInterface
interface Step {
    void run(Scope scope, Accumulator accumulator);
}
