package com.tokenx.vault;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;

public class ReencryptionFailureException extends VaultException {

    private final ReencryptionResult result;

    public ReencryptionFailureException(ReencryptionResult result) {
        super(ErrorKind.PARTIAL_REENCRYPTION_FAILURE,
            "Password NOT changed. The following credentials could not be re-encrypted: "
                + String.join(", ", result.getFailed()));
        this.result = result;
    }

    public ReencryptionResult getResult() {
        return result;
    }
}
