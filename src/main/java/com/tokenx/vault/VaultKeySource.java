package com.tokenx.vault;

import com.tokenx.crypto.KeyDerivation;

import java.util.Locale;

/**
 * Which value keys the per-credential envelopes. The master-key file itself is always keyed by
 * the master password.
 */
public enum VaultKeySource {
    /** Envelopes keyed by the master password (PBKDF2-HMAC-SHA256); rotation re-encrypts every file. */
    PASSWORD("password", KeyDerivation.PBKDF2_SHA256),
    /** Envelopes keyed by the master secret (PBKDF2-HMAC-SHA512); rotation only re-wraps the master key. */
    MASTER_SECRET("master-secret", KeyDerivation.PBKDF2_SHA512);

    private final String configName;
    private final KeyDerivation derivation;

    VaultKeySource(String configName, KeyDerivation derivation) {
        this.configName = configName;
        this.derivation = derivation;
    }

    public String getConfigName() {
        return configName;
    }

    public KeyDerivation getDerivation() {
        return derivation;
    }

    public static VaultKeySource fromConfig(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (VaultKeySource source : values()) {
            if (source.configName.equals(normalized)) {
                return source;
            }
        }
        return null;
    }
}
