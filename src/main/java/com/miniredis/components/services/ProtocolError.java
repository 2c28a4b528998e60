package com.miniredis.components.services;

public enum ProtocolError {
    EMPTY("empty command"),
    TOO_LONG("command too long"),
    INVALID_UTF8("invalid UTF-8"),
    UNKNOWN_COMMAND("unknown command"),
    BAD_ARGUMENTS("bad arguments");

    private final String message;

    ProtocolError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
