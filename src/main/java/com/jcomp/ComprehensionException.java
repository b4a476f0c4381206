package com.jcomp;

/**
 * Root of every failure raised while translating or evaluating a comprehension.
 */
public class ComprehensionException extends RuntimeException {

    public ComprehensionException(String message) {
        super(message);
    }

    public ComprehensionException(String message, Throwable cause) {
        super(message, cause);
    }
}
