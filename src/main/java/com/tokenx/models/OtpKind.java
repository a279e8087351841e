package com.tokenx.models;

import java.util.Locale;

public enum OtpKind {
    TOTP("totp"),
    HOTP("hotp");

    private final String uriName;

    OtpKind(String uriName) {
        this.uriName = uriName;
    }

    /**
     * Lowercase form used as the otpauth authority and the JSON {@code type}.
     */
    public String getUriName() {
        return uriName;
    }

    public static OtpKind fromName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OtpKind kind : values()) {
            if (kind.uriName.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
