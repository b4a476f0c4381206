package com.jcomp.comprehension;

import com.jcomp.token.Fragment;

/**
 * What a comprehension does with each innermost iteration.
 */
public sealed interface BodyKind {

    OutputKind outputKind();

    record Sequence(Fragment expr) implements BodyKind {
        @Override
        public OutputKind outputKind() {
            return OutputKind.SEQUENCE;
        }
    }

    record Mapping(Fragment key, Fragment value) implements BodyKind {
        @Override
        public OutputKind outputKind() {
            return OutputKind.MAPPING;
        }
    }

    /** The statement terminator is already stripped from {@code stmt}. */
    record Statement(Fragment stmt) implements BodyKind {
        @Override
        public OutputKind outputKind() {
            return OutputKind.STATEMENT;
        }
    }
}
