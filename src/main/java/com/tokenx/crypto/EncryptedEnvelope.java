package com.tokenx.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Self-contained container: {@code salt(16) || nonce(12) || ciphertext||tag}.
 */
public final class EncryptedEnvelope {
    public static final int SALT_BYTES = 16;
    public static final int NONCE_BYTES = 12;
    public static final int HEADER_BYTES = SALT_BYTES + NONCE_BYTES;

    private final byte[] salt;
    private final byte[] nonce;
    private final byte[] ciphertext;

    public EncryptedEnvelope(byte[] salt, byte[] nonce, byte[] ciphertext) {
        if (salt == null || salt.length != SALT_BYTES) {
            throw new IllegalArgumentException("salt must be " + SALT_BYTES + " bytes");
        }
        if (nonce == null || nonce.length != NONCE_BYTES) {
            throw new IllegalArgumentException("nonce must be " + NONCE_BYTES + " bytes");
        }
        this.salt = salt.clone();
        this.nonce = nonce.clone();
        this.ciphertext = ciphertext == null ? new byte[0] : ciphertext.clone();
    }

    public static EncryptedEnvelope fromBytes(byte[] data) throws DecryptionFailureException {
        if (data == null || data.length < HEADER_BYTES) {
            throw new DecryptionFailureException();
        }
        return new EncryptedEnvelope(
            Arrays.copyOfRange(data, 0, SALT_BYTES),
            Arrays.copyOfRange(data, SALT_BYTES, HEADER_BYTES),
            Arrays.copyOfRange(data, HEADER_BYTES, data.length));
    }

    public static EncryptedEnvelope fromBase64(String text) throws DecryptionFailureException {
        if (text == null) {
            throw new DecryptionFailureException();
        }
        try {
            return fromBytes(Base64.getMimeDecoder().decode(text.trim()));
        } catch (IllegalArgumentException e) {
            throw new DecryptionFailureException();
        }
    }

    /**
     * Reads an envelope as stored on disk: Base64 text (the canonical form) or, for older
     * binary exports, the raw envelope bytes.
     */
    public static EncryptedEnvelope fromStoredBytes(byte[] stored) throws DecryptionFailureException {
        if (stored == null) {
            throw new DecryptionFailureException();
        }
        if (isBase64Text(stored)) {
            return fromBase64(new String(stored, StandardCharsets.US_ASCII));
        }
        return fromBytes(stored);
    }

    private static boolean isBase64Text(byte[] data) {
        if (data.length == 0) {
            return false;
        }
        for (byte b : data) {
            char c = (char) (b & 0xFF);
            boolean allowed = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '+' || c == '/' || c == '=' || c == '\r' || c == '\n' || c == ' ';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    public byte[] toBytes() {
        byte[] out = new byte[HEADER_BYTES + ciphertext.length];
        System.arraycopy(salt, 0, out, 0, SALT_BYTES);
        System.arraycopy(nonce, 0, out, SALT_BYTES, NONCE_BYTES);
        System.arraycopy(ciphertext, 0, out, HEADER_BYTES, ciphertext.length);
        return out;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(toBytes());
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedEnvelope)) {
            return false;
        }
        EncryptedEnvelope other = (EncryptedEnvelope) o;
        return Arrays.equals(salt, other.salt)
            && Arrays.equals(nonce, other.nonce)
            && Arrays.equals(ciphertext, other.ciphertext);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(salt);
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(ciphertext);
        return result;
    }
}
