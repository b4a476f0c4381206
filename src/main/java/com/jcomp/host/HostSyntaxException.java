package com.jcomp.host;

import com.jcomp.ComprehensionException;

public class HostSyntaxException extends ComprehensionException {

    private final String fragment;
    private final int position;

    public HostSyntaxException(String message, String fragment, int position) {
        super(message + " in '" + fragment + "' at " + position);
        this.fragment = fragment;
        this.position = position;
    }

    public String getFragment() {
        return fragment;
    }

    public int getPosition() {
        return position;
    }
}
