package com.tokenx;

/**
 * Checked failure carrying the {@link ErrorKind} that callers branch on.
 */
public class VaultException extends Exception {

    private final ErrorKind kind;

    public VaultException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public VaultException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
