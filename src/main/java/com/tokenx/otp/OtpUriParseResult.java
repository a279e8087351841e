package com.tokenx.otp;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.models.Credential;

public class OtpUriParseResult {
    private final Credential credential;
    private final ErrorKind errorKind;
    private final String errorDetail;

    private OtpUriParseResult(Credential credential, ErrorKind errorKind, String errorDetail) {
        this.credential = credential;
        this.errorKind = errorKind;
        this.errorDetail = errorDetail;
    }

    public static OtpUriParseResult success(Credential credential) {
        return new OtpUriParseResult(credential, null, null);
    }

    public static OtpUriParseResult error(ErrorKind errorKind, String detail) {
        return new OtpUriParseResult(null, errorKind, detail);
    }

    public boolean isSuccess() {
        return credential != null;
    }

    public Credential getCredential() {
        return credential;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public VaultException toException() {
        return new VaultException(errorKind, errorDetail);
    }
}
