package com.jcomp.comprehension;

public enum OutputKind {
    SEQUENCE,
    MAPPING,
    STATEMENT
}
