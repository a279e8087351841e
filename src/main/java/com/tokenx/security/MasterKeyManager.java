package com.tokenx.security;

import com.tokenx.AppLogger;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.crypto.CryptoEnvelope;
import com.tokenx.crypto.EncryptedEnvelope;
import com.tokenx.storage.FileStorage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Owns the master-key file: Base64 text of one envelope that wraps the {@link MasterSecret}
 * under the master password.
 */
public class MasterKeyManager {
    public static final String MASTER_KEY_FILE = ".master";

    private final Path masterKeyPath;
    private final CryptoEnvelope envelope;
    private final PasswordStrength passwordStrength;
    private final SecureRandom random = new SecureRandom();
    private final AppLogger logger = AppLogger.get();

    public MasterKeyManager(Path vaultDir, CryptoEnvelope envelope, PasswordStrength passwordStrength) {
        this.masterKeyPath = vaultDir.resolve(MASTER_KEY_FILE);
        this.envelope = envelope;
        this.passwordStrength = passwordStrength;
    }

    public Path getMasterKeyPath() {
        return masterKeyPath;
    }

    public boolean isInitialized() {
        return Files.isRegularFile(masterKeyPath);
    }

    /**
     * First run: checks the password against the strength gate, then creates and stores a new
     * master secret.
     */
    public MasterSecret initialize(String password, String confirmation) throws VaultException {
        if (isInitialized()) {
            throw new VaultException(ErrorKind.VAULT_ALREADY_INITIALIZED, "A master password is already set.");
        }
        passwordStrength.requireAcceptable(password, confirmation);
        MasterSecret secret = MasterSecret.generate(random);
        write(secret, password);
        log("Master key created");
        return secret;
    }

    public MasterSecret authenticate(String password) throws VaultException {
        if (!isInitialized()) {
            throw new VaultException(ErrorKind.VAULT_NOT_INITIALIZED, "No master password has been set.");
        }
        byte[] stored;
        try {
            stored = Files.readAllBytes(masterKeyPath);
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to read master key file", e);
        }
        byte[] plaintext = envelope.decrypt(EncryptedEnvelope.fromStoredBytes(stored), password);
        return MasterSecret.fromEncoded(plaintext);
    }

    /**
     * Stores the same master secret under a new password.
     */
    public void rewrap(MasterSecret secret, String newPassword) throws VaultException {
        write(secret, newPassword);
        log("Master key re-wrapped under a new password");
    }

    public void reset() throws VaultException {
        try {
            Files.deleteIfExists(masterKeyPath);
            log("Master key removed");
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to delete master key file", e);
        }
    }

    private void write(MasterSecret secret, String password) throws VaultException {
        String text;
        try {
            text = envelope.encrypt(secret.toUtf8(), password).toBase64();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        }
        try {
            FileStorage.writeAtomic(masterKeyPath, text);
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to write master key file", e);
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[MasterKeyManager] " + message);
        }
    }
}
