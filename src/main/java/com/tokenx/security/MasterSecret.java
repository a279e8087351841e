package com.tokenx.security;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * The 256-bit root secret. Its text form (URL-safe Base64 with padding) is what the
 * master-key envelope wraps and what credential envelopes are keyed with in master-secret mode.
 */
public final class MasterSecret {
    public static final int SECRET_BYTES = 32;

    private final String encoded;

    private MasterSecret(String encoded) {
        this.encoded = encoded;
    }

    public static MasterSecret generate(SecureRandom random) {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        String encoded = Base64.getUrlEncoder().encodeToString(bytes);
        Arrays.fill(bytes, (byte) 0);
        return new MasterSecret(encoded);
    }

    static MasterSecret fromEncoded(byte[] utf8) {
        return new MasterSecret(new String(utf8, StandardCharsets.UTF_8).trim());
    }

    public String encoded() {
        return encoded;
    }

    public byte[] toUtf8() {
        return encoded.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "MasterSecret{***}";
    }
}
