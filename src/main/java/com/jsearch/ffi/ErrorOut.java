package com.jsearch.ffi;

/**
 * Out-parameter receiving the error of a failed bridge call. Left untouched
 * by successful calls.
 */
public final class ErrorOut {
    private String message;
    private ErrorKind kind;

    void set(ErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public boolean isSet() {
        return kind != null;
    }

    public String getMessage() {
        return message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public void clear() {
        kind = null;
        message = null;
    }

    @Override
    public String toString() {
        return isSet() ? kind + ": " + message : "no error";
    }
}
