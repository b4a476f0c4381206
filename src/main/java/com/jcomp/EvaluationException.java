package com.jcomp;

/**
 * Raised while a translated comprehension runs. Aborts the whole evaluation.
 */
public class EvaluationException extends ComprehensionException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
