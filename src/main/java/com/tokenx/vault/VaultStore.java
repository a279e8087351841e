package com.tokenx.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.AppLogger;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.crypto.CryptoEnvelope;
import com.tokenx.crypto.DecryptionFailureException;
import com.tokenx.crypto.EncryptedEnvelope;
import com.tokenx.models.Credential;
import com.tokenx.models.CredentialFile;
import com.tokenx.storage.FileStorage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persistence layer for encrypted credentials.
 *
 * Layout:
 *   {vaultDir}/
 *   ├── {name}.enc       one envelope per credential (Base64 text)
 *   ├── .master          master-key envelope (see MasterKeyManager)
 *   └── settings.json    session settings
 *
 * Not thread-safe on its own; VaultSession serializes every call.
 */
public class VaultStore {

    /**
     * Final rename of a staged re-encryption file.
     */
    interface TempCommitter {
        void commit(Path tempFile, Path target) throws IOException;
    }

    private final Path vaultDir;
    private final CryptoEnvelope envelope;
    private final ObjectMapper objectMapper;
    private final TempCommitter committer;
    private final AppLogger logger = AppLogger.get();

    private VaultStore(Path vaultDir, CryptoEnvelope envelope, ObjectMapper objectMapper, TempCommitter committer) {
        this.vaultDir = vaultDir;
        this.envelope = envelope;
        this.objectMapper = objectMapper;
        this.committer = committer;
    }

    public static VaultStore open(Path vaultDir, CryptoEnvelope envelope) throws VaultException {
        return open(vaultDir, envelope, new ObjectMapper());
    }

    public static VaultStore open(Path vaultDir, CryptoEnvelope envelope, ObjectMapper objectMapper)
            throws VaultException {
        return open(vaultDir, envelope, objectMapper, FileStorage::commitTemp);
    }

    static VaultStore open(Path vaultDir, CryptoEnvelope envelope, ObjectMapper objectMapper,
                           TempCommitter committer) throws VaultException {
        try {
            Files.createDirectories(vaultDir);
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Cannot create vault directory " + vaultDir, e);
        }
        return new VaultStore(vaultDir, envelope, objectMapper, committer);
    }

    public Path getVaultDir() {
        return vaultDir;
    }

    public CryptoEnvelope getEnvelope() {
        return envelope;
    }

    public Path pathFor(String name) {
        return vaultDir.resolve(VaultFileNames.fileName(name));
    }

    public boolean exists(String name) {
        return Files.isRegularFile(pathFor(name));
    }

    /**
     * Encrypts the credential under {@code key} and writes it atomically, replacing any file of the
     * same name.
     */
    public void save(String name, Credential credential, String key) throws VaultException {
        requireValidName(name);
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(CredentialFile.from(credential));
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to serialize credential " + name, e);
        }
        String text;
        try {
            text = envelope.encryptToText(json, key);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        } finally {
            Arrays.fill(json, (byte) 0);
        }
        try {
            FileStorage.writeAtomic(pathFor(name), text);
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to write credential " + name, e);
        }
        if (logger != null) {
            logger.debug("[VaultStore] Saved " + name);
        }
    }

    /**
     * Reads one credential. Any read, decrypt or parse failure yields empty.
     */
    public Optional<Credential> load(String name, String key) {
        Path file = pathFor(name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(decode(Files.readAllBytes(file), key));
        } catch (IOException e) {
            warn("Could not read " + name + ": " + e.getMessage());
        } catch (DecryptionFailureException e) {
            warn("Could not decrypt " + name);
        } catch (IllegalArgumentException e) {
            warn("Invalid credential data in " + name + ": " + e.getMessage());
        }
        return Optional.empty();
    }

    public VaultLoadSummary loadAll(String key) throws VaultException {
        Map<String, Credential> loaded = new TreeMap<>();
        List<String> failed = new ArrayList<>();
        for (String name : listNames()) {
            Optional<Credential> credential = load(name, key);
            if (credential.isPresent()) {
                loaded.put(name, credential.get());
            } else {
                failed.add(name);
            }
        }
        if (!failed.isEmpty()) {
            warn(failed.size() + " credential file(s) failed to load");
        }
        log("Loaded " + loaded.size() + " credential(s)");
        return new VaultLoadSummary(loaded, failed);
    }

    public boolean delete(String name) throws VaultException {
        requireValidName(name);
        try {
            boolean deleted = Files.deleteIfExists(pathFor(name));
            if (deleted) {
                log("Deleted " + name);
            }
            return deleted;
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to delete credential " + name, e);
        }
    }

    /**
     * Names of all credential files, sorted.
     */
    public List<String> listNames() throws VaultException {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(vaultDir)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(vaultDir)) {
            for (Path entry : stream) {
                String fileName = entry.getFileName().toString();
                if (VaultFileNames.isVaultFile(fileName) && Files.isRegularFile(entry)) {
                    names.add(VaultFileNames.nameOf(fileName));
                }
            }
        } catch (IOException e) {
            throw new VaultException(ErrorKind.IO_FAILURE, "Failed to list vault directory", e);
        }
        names.sort(String::compareTo);
        return names;
    }

    /**
     * Deletes every credential file. Returns the number removed.
     */
    public int resetAll() throws VaultException {
        int removed = 0;
        for (String name : listNames()) {
            try {
                if (Files.deleteIfExists(pathFor(name))) {
                    removed++;
                }
            } catch (IOException e) {
                throw new VaultException(ErrorKind.IO_FAILURE, "Failed to delete credential " + name, e);
            }
        }
        log("Reset removed " + removed + " credential file(s)");
        return removed;
    }

    /**
     * Re-encrypts every credential file from {@code oldKey} to {@code newKey}.
     *
     * Stage 1 decrypts everything in memory. If any file fails, nothing is written and the result
     * is not committed. Stage 2 writes every new envelope to a temp file; an I/O error there
     * removes the temps and raises IO_FAILURE. Stage 3 renames the temps into place; if a rename
     * fails, the remaining temps are removed, files already renamed are rewritten under
     * {@code oldKey}, and IO_FAILURE is raised.
     */
    public ReencryptionResult reencryptAll(String oldKey, String newKey) throws VaultException {
        Map<String, byte[]> plaintexts = new LinkedHashMap<>();
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        try {
            for (String name : listNames()) {
                try {
                    byte[] stored = Files.readAllBytes(pathFor(name));
                    plaintexts.put(name, envelope.decrypt(EncryptedEnvelope.fromStoredBytes(stored), oldKey));
                    succeeded.add(name);
                } catch (IOException | DecryptionFailureException e) {
                    warn("Re-encryption cannot read " + name);
                    failed.add(name);
                }
            }
            if (!failed.isEmpty()) {
                warn("Re-encryption aborted: " + failed.size() + " of "
                    + (failed.size() + succeeded.size()) + " file(s) failed, nothing written");
                return new ReencryptionResult(succeeded, failed, false);
            }

            Map<String, Path> staged = new LinkedHashMap<>();
            String current = null;
            try {
                for (Map.Entry<String, byte[]> entry : plaintexts.entrySet()) {
                    current = entry.getKey();
                    String text = envelope.encryptToText(entry.getValue(), newKey);
                    staged.put(current, FileStorage.writeTemp(pathFor(current), text.getBytes(StandardCharsets.UTF_8)));
                }
            } catch (IOException e) {
                staged.values().forEach(FileStorage::deleteQuietly);
                if (current != null) {
                    FileStorage.deleteQuietly(tempPathFor(current));
                }
                throw new VaultException(ErrorKind.IO_FAILURE, "Failed to stage re-encrypted credentials", e);
            } catch (GeneralSecurityException e) {
                staged.values().forEach(FileStorage::deleteQuietly);
                throw new IllegalStateException("AES-GCM is not available", e);
            }

            List<String> committed = new ArrayList<>();
            for (Map.Entry<String, Path> entry : staged.entrySet()) {
                try {
                    committer.commit(entry.getValue(), pathFor(entry.getKey()));
                    committed.add(entry.getKey());
                } catch (IOException e) {
                    if (logger != null) {
                        logger.error("[VaultStore] Re-encryption commit failed at " + entry.getKey(), e);
                    }
                    staged.values().forEach(FileStorage::deleteQuietly);
                    restoreCommitted(committed, plaintexts, oldKey);
                    throw new VaultException(ErrorKind.IO_FAILURE,
                        "Failed to commit re-encrypted credential " + entry.getKey(), e);
                }
            }
            log("Re-encrypted " + succeeded.size() + " credential(s)");
            return new ReencryptionResult(succeeded, failed, true);
        } finally {
            plaintexts.values().forEach(bytes -> Arrays.fill(bytes, (byte) 0));
        }
    }

    /**
     * Puts files that were already renamed into place back under {@code oldKey}, so a failed
     * commit leaves every file readable with the old key.
     */
    private void restoreCommitted(List<String> committed, Map<String, byte[]> plaintexts, String oldKey) {
        List<String> unrestored = new ArrayList<>();
        for (String name : committed) {
            try {
                FileStorage.writeAtomic(pathFor(name), envelope.encryptToText(plaintexts.get(name), oldKey));
            } catch (IOException | GeneralSecurityException e) {
                unrestored.add(name);
            }
        }
        if (!committed.isEmpty()) {
            warn("Restored " + (committed.size() - unrestored.size()) + " of " + committed.size()
                + " committed file(s) to the old key");
        }
        if (!unrestored.isEmpty() && logger != null) {
            logger.error("[VaultStore] Files left under the new key after a failed commit: " + unrestored);
        }
    }

    private Credential decode(byte[] stored, String key) throws DecryptionFailureException, IOException {
        byte[] json = envelope.decrypt(EncryptedEnvelope.fromStoredBytes(stored), key);
        try {
            return objectMapper.readValue(json, CredentialFile.class).toCredential();
        } finally {
            Arrays.fill(json, (byte) 0);
        }
    }

    private Path tempPathFor(String name) {
        return vaultDir.resolve(VaultFileNames.fileName(name) + FileStorage.TEMP_SUFFIX);
    }

    private static void requireValidName(String name) throws VaultException {
        if (!VaultFileNames.isValidName(name)) {
            throw new VaultException(ErrorKind.CREDENTIAL_NOT_FOUND, "Invalid credential name: " + name);
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[VaultStore] " + message);
        }
    }

    private void warn(String message) {
        if (logger != null) {
            logger.warn("[VaultStore] " + message);
        }
    }
}
