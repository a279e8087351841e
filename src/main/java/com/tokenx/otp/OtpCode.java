package com.tokenx.otp;

public class OtpCode {

    private final String code;
    private final int remainingSeconds;

    public OtpCode(String code, int remainingSeconds) {
        this.code = code;
        this.remainingSeconds = remainingSeconds;
    }

    public String getCode() {
        return code;
    }

    /**
     * Seconds until the TOTP window rolls over; 0 for HOTP.
     */
    public int getRemainingSeconds() {
        return remainingSeconds;
    }
}
