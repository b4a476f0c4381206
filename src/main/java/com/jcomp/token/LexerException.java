package com.jcomp.token;

import com.jcomp.ComprehensionException;

public class LexerException extends ComprehensionException {

    private final int position;

    public LexerException(String message, int position) {
        super(message + " at " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
