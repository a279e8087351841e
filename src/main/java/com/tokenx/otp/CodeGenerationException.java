package com.tokenx.otp;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;

public class CodeGenerationException extends VaultException {

    public CodeGenerationException(String message) {
        super(ErrorKind.CODE_GENERATION_FAILURE, message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(ErrorKind.CODE_GENERATION_FAILURE, message, cause);
    }
}
