package com.tapas.orderstream.validator.sink;

public enum SinkKind {
    VALID("valid"),
    INVALID("invalid");

    private final String directory;

    SinkKind(String directory) {
        this.directory = directory;
    }

    public String directory() {
        return directory;
    }
}
