package com.tokenx.crypto;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

/**
 * Named password-based key derivations. The two variants produce different keys for the same
 * input and are not interchangeable: envelopes must be opened with the derivation that sealed them.
 */
public enum KeyDerivation {
    /** Credential files and the master-key file. */
    PBKDF2_SHA256("PBKDF2WithHmacSHA256"),
    /** Credential files keyed by the master secret. */
    PBKDF2_SHA512("PBKDF2WithHmacSHA512");

    public static final int DEFAULT_ITERATIONS = 100_000;
    public static final int KEY_BITS = 256;

    private final String algorithm;

    KeyDerivation(String algorithm) {
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * Derives a 32-byte AES key. Password characters are fed to PBKDF2 as UTF-8.
     */
    public SecretKey deriveKey(String password, byte[] salt, int iterations) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(algorithm);
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } finally {
            spec.clearPassword();
        }
    }
}
