package com.jcomp.comprehension;

import com.jcomp.token.Fragment;

public sealed interface Clause {

    /** {@code for pattern in iterable} */
    record For(Fragment pattern, Fragment iterable) implements Clause {}

    /** {@code if condition} */
    record If(Fragment condition) implements Clause {}
}
