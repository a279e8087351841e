package com.tokenx.models;

import java.util.Locale;

/**
 * HMAC functions accepted for code truncation.
 */
public enum OtpAlgorithm {
    SHA1("HmacSHA1"),
    SHA256("HmacSHA256"),
    SHA512("HmacSHA512"),
    MD5("HmacMD5");

    private final String macName;

    OtpAlgorithm(String macName) {
        this.macName = macName;
    }

    public String getMacName() {
        return macName;
    }

    public static OtpAlgorithm fromName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OtpAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        return null;
    }
}
