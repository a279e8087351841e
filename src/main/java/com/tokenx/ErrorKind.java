package com.tokenx;

/**
 * Every failure the vault reports to its callers.
 */
public enum ErrorKind {
    INVALID_URI,
    MISSING_FIELD,
    INVALID_SECRET,
    INVALID_ALGORITHM,
    INVALID_DIGITS,
    INVALID_PERIOD,
    INVALID_COUNTER,
    DECRYPTION_FAILURE,
    IO_FAILURE,
    WEAK_PASSWORD,
    PASSWORD_MISMATCH,
    PARTIAL_REENCRYPTION_FAILURE,
    VAULT_LOCKED,
    VAULT_NOT_INITIALIZED,
    VAULT_ALREADY_INITIALIZED,
    SESSION_TERMINATED,
    CREDENTIAL_EXISTS,
    CREDENTIAL_NOT_FOUND,
    CODE_GENERATION_FAILURE,
    NO_QR_CODE;

    /**
     * True for the URI and field validation kinds produced while parsing an import.
     */
    public boolean isValidationError() {
        switch (this) {
            case INVALID_URI:
            case MISSING_FIELD:
            case INVALID_SECRET:
            case INVALID_ALGORITHM:
            case INVALID_DIGITS:
            case INVALID_PERIOD:
            case INVALID_COUNTER:
                return true;
            default:
                return false;
        }
    }
}
