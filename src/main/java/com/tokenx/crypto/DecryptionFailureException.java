package com.tokenx.crypto;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;

/**
 * Wrong password, tampered data and truncated envelopes all surface as this one failure
 * with the same message.
 */
public class DecryptionFailureException extends VaultException {

    public static final String MESSAGE = "Unable to decrypt envelope";

    public DecryptionFailureException() {
        super(ErrorKind.DECRYPTION_FAILURE, MESSAGE);
    }
}
