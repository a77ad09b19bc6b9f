package com.delta.notifier.source;

public class EntryFetchException extends Exception {
    public enum Kind {
        NETWORK,
        PARSE_FAILURE
    }

    private final Kind kind;

    public EntryFetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EntryFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
