package com.jcomp;

public class ComprehensionSyntaxException extends ComprehensionException {

    private final ErrorKind kind;
    private final int position;

    public ComprehensionSyntaxException(ErrorKind kind, String message, int position) {
        super(message + " (" + kind + " at " + position + ")");
        this.kind = kind;
        this.position = position;
    }

    public ComprehensionSyntaxException(ErrorKind kind, String message, int position, Throwable cause) {
        super(message + " (" + kind + " at " + position + ")", cause);
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Character offset into the comprehension source, or -1 when unknown.
     */
    public int getPosition() {
        return position;
    }
}
