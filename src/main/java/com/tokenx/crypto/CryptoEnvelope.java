package com.tokenx.crypto;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Password-based authenticated encryption: PBKDF2 key derivation, AES-256-GCM with a 128-bit tag
 * and no associated data. Every call to {@link #encrypt} draws a fresh salt and nonce.
 */
public class CryptoEnvelope {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;

    private final KeyDerivation derivation;
    private final int iterations;
    private final SecureRandom random;

    public CryptoEnvelope() {
        this(KeyDerivation.PBKDF2_SHA256, KeyDerivation.DEFAULT_ITERATIONS);
    }

    public CryptoEnvelope(KeyDerivation derivation, int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.derivation = derivation;
        this.iterations = iterations;
        this.random = new SecureRandom();
    }

    public KeyDerivation getDerivation() {
        return derivation;
    }

    public int getIterations() {
        return iterations;
    }

    public EncryptedEnvelope encrypt(byte[] plaintext, String password) throws GeneralSecurityException {
        byte[] salt = new byte[EncryptedEnvelope.SALT_BYTES];
        byte[] nonce = new byte[EncryptedEnvelope.NONCE_BYTES];
        random.nextBytes(salt);
        random.nextBytes(nonce);

        SecretKey key = derivation.deriveKey(password, salt, iterations);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, nonce));
        return new EncryptedEnvelope(salt, nonce, cipher.doFinal(plaintext));
    }

    public byte[] decrypt(EncryptedEnvelope envelope, String password) throws DecryptionFailureException {
        if (envelope == null || password == null) {
            throw new DecryptionFailureException();
        }
        try {
            SecretKey key = derivation.deriveKey(password, envelope.getSalt(), iterations);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, envelope.getNonce()));
            return cipher.doFinal(envelope.getCiphertext());
        } catch (GeneralSecurityException e) {
            // no cause attached: tag, key and padding failures must look identical
            throw new DecryptionFailureException();
        }
    }

    public byte[] decrypt(byte[] envelopeBytes, String password) throws DecryptionFailureException {
        return decrypt(EncryptedEnvelope.fromBytes(envelopeBytes), password);
    }

    public String encryptToText(byte[] plaintext, String password) throws GeneralSecurityException {
        return encrypt(plaintext, password).toBase64();
    }

    public byte[] decryptText(String base64Envelope, String password) throws DecryptionFailureException {
        return decrypt(EncryptedEnvelope.fromBase64(base64Envelope), password);
    }

    public String encryptString(String plaintext, String password) throws GeneralSecurityException {
        return encryptToText(plaintext.getBytes(StandardCharsets.UTF_8), password);
    }

    public String decryptString(String base64Envelope, String password) throws DecryptionFailureException {
        return new String(decryptText(base64Envelope, password), StandardCharsets.UTF_8);
    }
}
