package com.tokenx.vault;

import com.tokenx.AppLogger;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.crypto.DecryptionFailureException;
import com.tokenx.crypto.EncryptedEnvelope;
import com.tokenx.models.CodeView;
import com.tokenx.models.Credential;
import com.tokenx.otp.CodeGenerationException;
import com.tokenx.otp.CodeGenerator;
import com.tokenx.otp.OtpCode;
import com.tokenx.otp.OtpUriParser;
import com.tokenx.qr.QrCodeService;
import com.tokenx.security.MasterKeyManager;
import com.tokenx.security.MasterSecret;
import com.tokenx.security.PasswordStrength;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory session over one vault directory.
 *
 * Holds the master password, the master secret and the decrypted credentials while unlocked, and
 * drops all three on lock. Every state change and every VaultStore access happens under one lock,
 * shared by HTTP handler threads and the scheduler thread.
 *
 * A failed unlock is fatal: the session moves to TERMINATED, the termination listener is told,
 * and every later call fails with SESSION_TERMINATED.
 */
public class VaultSession {

    public enum State {
        UNINITIALIZED,
        LOCKED,
        UNLOCKED,
        TERMINATED
    }

    public interface TerminationListener {
        /**
         * Called once, outside the session lock.
         */
        void onTerminated(String reason);
    }

    private static final String OTPAUTH_PREFIX = OtpUriParser.SCHEME_PREFIX;

    private final VaultStore store;
    private final MasterKeyManager masterKeys;
    private final PasswordStrength passwordStrength;
    private final CodeGenerator codeGenerator;
    private final OtpUriParser uriParser;
    private final QrCodeService qrCodeService;
    private final VaultKeySource keySource;
    private final Duration idleTimeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final AppLogger logger = AppLogger.get();

    private State state;
    private String password;
    private MasterSecret masterSecret;
    private final Map<String, Credential> credentials = new TreeMap<>();
    private volatile List<CodeView> codeSnapshot = Collections.emptyList();
    private Instant lastActivity;
    private String lastScannedText;
    private volatile String lastImportStatus;
    private TerminationListener terminationListener;

    public VaultSession(VaultStore store, MasterKeyManager masterKeys, PasswordStrength passwordStrength,
                        CodeGenerator codeGenerator, OtpUriParser uriParser, QrCodeService qrCodeService,
                        VaultKeySource keySource, Duration idleTimeout, Clock clock) {
        this.store = store;
        this.masterKeys = masterKeys;
        this.passwordStrength = passwordStrength;
        this.codeGenerator = codeGenerator;
        this.uriParser = uriParser;
        this.qrCodeService = qrCodeService;
        this.keySource = keySource != null ? keySource : VaultKeySource.PASSWORD;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
        this.state = masterKeys.isInitialized() ? State.LOCKED : State.UNINITIALIZED;
    }

    public void setTerminationListener(TerminationListener terminationListener) {
        this.terminationListener = terminationListener;
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public VaultKeySource getKeySource() {
        return keySource;
    }

    // ===== Authentication =====

    /**
     * First run: creates the master key and opens an empty session.
     */
    public void setup(String newPassword, String confirmation) throws VaultException {
        lock.lock();
        try {
            requireNotTerminated();
            if (state != State.UNINITIALIZED || masterKeys.isInitialized()) {
                throw new VaultException(ErrorKind.VAULT_ALREADY_INITIALIZED, "A master password is already set.");
            }
            MasterSecret secret = masterKeys.initialize(newPassword, confirmation);
            open(newPassword, secret);
            credentials.clear();
            refreshCodesLocked();
            log("Vault initialized (key source " + keySource.getConfigName() + ")");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Login or re-authentication after lock. A wrong password or unreadable master key terminates
     * the session.
     */
    public VaultLoadSummary unlock(String candidate) throws VaultException {
        String terminationReason = null;
        lock.lock();
        try {
            requireNotTerminated();
            if (state == State.UNINITIALIZED) {
                throw new VaultException(ErrorKind.VAULT_NOT_INITIALIZED, "No master password has been set.");
            }
            MasterSecret secret;
            try {
                secret = masterKeys.authenticate(candidate);
            } catch (DecryptionFailureException e) {
                terminationReason = "Incorrect password.";
                terminateLocked(terminationReason);
                throw e;
            } catch (VaultException e) {
                if (e.getKind() == ErrorKind.IO_FAILURE) {
                    terminationReason = "Master key could not be read.";
                    terminateLocked(terminationReason);
                }
                throw e;
            }
            open(candidate, secret);
            VaultLoadSummary summary = store.loadAll(vaultKey());
            credentials.clear();
            credentials.putAll(summary.getLoaded());
            refreshCodesLocked();
            log("Session unlocked: " + summary.getLoadedCount() + " loaded, "
                + summary.getFailedCount() + " failed");
            return summary;
        } finally {
            lock.unlock();
            if (terminationReason != null) {
                notifyTerminated(terminationReason);
            }
        }
    }

    public void lock() {
        lock.lock();
        try {
            if (state == State.UNLOCKED) {
                clearSecrets();
                state = State.LOCKED;
                log("Session locked");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records user activity, postponing the idle lock.
     */
    public void touch() throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            lastActivity = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Locks the session if it has been idle for at least the idle timeout.
     *
     * @return true if this call locked the session
     */
    public boolean checkIdle() {
        lock.lock();
        try {
            if (state != State.UNLOCKED || lastActivity == null) {
                return false;
            }
            Duration idle = Duration.between(lastActivity, clock.instant());
            if (idle.compareTo(idleTimeout) < 0) {
                return false;
            }
            clearSecrets();
            state = State.LOCKED;
            log("Session locked after " + idle.getSeconds() + "s of inactivity");
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Verifies the current password, gates the new one, then rotates.
     *
     * In password mode every credential file is re-encrypted with a staged commit before the master
     * key is re-wrapped; if any file cannot be decrypted nothing on disk changes. In master-secret
     * mode only the master key is re-wrapped.
     */
    public ReencryptionResult changePassword(String current, String newPassword, String confirmation)
            throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            if (!constantTimeEquals(current, password)) {
                throw new VaultException(ErrorKind.PASSWORD_MISMATCH, "Current password is incorrect.");
            }
            passwordStrength.requireAcceptable(newPassword, confirmation);
            lastActivity = clock.instant();

            ReencryptionResult result;
            if (keySource == VaultKeySource.PASSWORD) {
                result = store.reencryptAll(password, newPassword);
                if (!result.isCommitted()) {
                    throw new ReencryptionFailureException(result);
                }
                try {
                    masterKeys.rewrap(masterSecret, newPassword);
                } catch (VaultException e) {
                    rollBackReencryption(newPassword, password);
                    throw e;
                }
            } else {
                masterKeys.rewrap(masterSecret, newPassword);
                result = new ReencryptionResult(store.listNames(), Collections.emptyList(), true);
            }
            password = newPassword;
            log("Master password changed (" + result.getSucceeded().size() + " credential file(s))");
            return result;
        } finally {
            lock.unlock();
        }
    }

    // ===== Credentials =====

    /**
     * Current code list. Codes are recomputed from memory, so this never touches the disk.
     */
    public List<CodeView> codes() throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            return refreshCodesLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Scheduler tick: recomputes the code snapshot if unlocked. Never records activity.
     */
    public List<CodeView> refreshCodes() {
        lock.lock();
        try {
            if (state != State.UNLOCKED) {
                codeSnapshot = Collections.emptyList();
                return codeSnapshot;
            }
            return refreshCodesLocked();
        } finally {
            lock.unlock();
        }
    }

    public List<CodeView> getCodeSnapshot() {
        return codeSnapshot;
    }

    /**
     * Parses and stores one otpauth URI.
     *
     * @return the vault name the credential was saved under
     */
    public String importUri(String uri, boolean overwrite) throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            lastActivity = clock.instant();
            String name = importLocked(uriParser.parseOrThrow(uri), overwrite);
            lastImportStatus = "Imported " + name;
            return name;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Imports from a QR image, or from an encrypted QR export when {@code encrypted} is set.
     */
    public String importImage(byte[] data, boolean overwrite, boolean encrypted) throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            lastActivity = clock.instant();
            byte[] image = encrypted ? decryptExport(data) : data;
            String uri = qrCodeService.decode(image);
            String name = importLocked(uriParser.parseOrThrow(uri), overwrite);
            lastImportStatus = "Imported " + name + " from QR";
            return name;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Scheduler path for clipboard text. Only new otpauth text is considered, existing names are never
     * overwritten, and the outcome is kept as the last import status instead of being thrown.
     *
     * @return the imported name, or empty if nothing was imported
     */
    public Optional<String> importScanned(String text) {
        if (text == null || !text.startsWith(OTPAUTH_PREFIX)) {
            return Optional.empty();
        }
        lock.lock();
        try {
            if (state != State.UNLOCKED || text.equals(lastScannedText)) {
                return Optional.empty();
            }
            lastScannedText = text;
            try {
                String name = importLocked(uriParser.parseOrThrow(text), false);
                lastImportStatus = "Clipboard imported: " + name;
                return Optional.of(name);
            } catch (VaultException e) {
                lastImportStatus = "Clipboard import failed: " + e.getMessage();
                warn("Clipboard import skipped (" + e.getKind() + ")");
                return Optional.empty();
            }
        } finally {
            lock.unlock();
        }
    }

    public void delete(String name) throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            lastActivity = clock.instant();
            if (!credentials.containsKey(name) && !store.exists(name)) {
                throw notFound(name);
            }
            store.delete(name);
            credentials.remove(name);
            refreshCodesLocked();
        } finally {
            lock.unlock();
        }
    }

    public String exportUri(String name) throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            lastActivity = clock.instant();
            return uriParser.build(requireCredential(name));
        } finally {
            lock.unlock();
        }
    }

    public byte[] exportQrPng(String name) throws VaultException {
        return qrCodeService.encodePng(exportUri(name));
    }

    /**
     * The credential's QR code PNG, encrypted under the vault key, as Base64 envelope text.
     */
    public String exportEncryptedQr(String name) throws VaultException {
        byte[] png = exportQrPng(name);
        lock.lock();
        try {
            requireUnlocked();
            return store.getEnvelope().encryptToText(png, vaultKey());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        } finally {
            lock.unlock();
        }
    }

    // ===== Vault maintenance =====

    public VaultLoadSummary reload() throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            lastActivity = clock.instant();
            VaultLoadSummary summary = store.loadAll(vaultKey());
            credentials.clear();
            credentials.putAll(summary.getLoaded());
            refreshCodesLocked();
            return summary;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every credential file and the master key. The session returns to UNINITIALIZED.
     */
    public int resetVault() throws VaultException {
        lock.lock();
        try {
            requireUnlocked();
            int removed = store.resetAll();
            masterKeys.reset();
            clearSecrets();
            lastScannedText = null;
            lastImportStatus = null;
            state = State.UNINITIALIZED;
            log("Vault reset: " + removed + " credential file(s) removed");
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public SessionStatus status() {
        lock.lock();
        try {
            SessionStatus status = new SessionStatus();
            status.setState(state.name());
            status.setInitialized(masterKeys.isInitialized());
            status.setCredentialCount(state == State.UNLOCKED ? credentials.size() : 0);
            status.setIdleTimeoutSecs(idleTimeout.getSeconds());
            status.setKeySource(keySource.getConfigName());
            status.setLastImportStatus(lastImportStatus);
            if (state == State.UNLOCKED && lastActivity != null) {
                status.setLastActivityAt(lastActivity.toEpochMilli());
                Duration left = idleTimeout.minus(Duration.between(lastActivity, clock.instant()));
                status.setIdleSecondsRemaining(Math.max(0L, left.getSeconds()));
            }
            return status;
        } finally {
            lock.unlock();
        }
    }

    // ===== Helpers (lock held) =====

    private String importLocked(Credential credential, boolean overwrite) throws VaultException {
        String name = VaultFileNames.sanitize(credential.getLabel());
        if (!overwrite && (credentials.containsKey(name) || store.exists(name))) {
            throw new VaultException(ErrorKind.CREDENTIAL_EXISTS, "Profile '" + name + "' exists.");
        }
        store.save(name, credential, vaultKey());
        credentials.put(name, credential);
        refreshCodesLocked();
        return name;
    }

    private byte[] decryptExport(byte[] data) throws VaultException {
        if (data == null) {
            throw new DecryptionFailureException();
        }
        return store.getEnvelope().decrypt(EncryptedEnvelope.fromStoredBytes(data), vaultKey());
    }

    private List<CodeView> refreshCodesLocked() {
        long now = codeGenerator.currentEpochSeconds();
        List<CodeView> views = new ArrayList<>(credentials.size());
        for (Map.Entry<String, Credential> entry : credentials.entrySet()) {
            Credential credential = entry.getValue();
            try {
                OtpCode code = codeGenerator.generate(credential, now);
                views.add(new CodeView(entry.getKey(), credential, code.getCode(), code.getRemainingSeconds(), true));
            } catch (CodeGenerationException e) {
                views.add(CodeView.unavailable(entry.getKey(), credential));
            }
        }
        codeSnapshot = Collections.unmodifiableList(views);
        return codeSnapshot;
    }

    private void rollBackReencryption(String fromKey, String toKey) {
        try {
            ReencryptionResult undo = store.reencryptAll(fromKey, toKey);
            if (!undo.isCommitted()) {
                error("Rollback after master key failure left " + undo.getFailed().size() + " file(s) unreadable", null);
            }
        } catch (VaultException e) {
            error("Rollback after master key failure did not complete", e);
        }
    }

    private Credential requireCredential(String name) throws VaultException {
        Credential credential = credentials.get(name);
        if (credential == null) {
            throw notFound(name);
        }
        return credential;
    }

    private static VaultException notFound(String name) {
        return new VaultException(ErrorKind.CREDENTIAL_NOT_FOUND, "No credential named '" + name + "'");
    }

    private String vaultKey() {
        return keySource == VaultKeySource.MASTER_SECRET ? masterSecret.encoded() : password;
    }

    private void open(String newPassword, MasterSecret secret) {
        this.password = newPassword;
        this.masterSecret = secret;
        this.lastActivity = clock.instant();
        this.state = State.UNLOCKED;
    }

    private void clearSecrets() {
        password = null;
        masterSecret = null;
        lastActivity = null;
        credentials.clear();
        codeSnapshot = Collections.emptyList();
    }

    private void terminateLocked(String reason) {
        clearSecrets();
        state = State.TERMINATED;
        warn("Session terminated: " + reason);
    }

    private void notifyTerminated(String reason) {
        TerminationListener listener = terminationListener;
        if (listener != null) {
            listener.onTerminated(reason);
        }
    }

    private void requireNotTerminated() throws VaultException {
        if (state == State.TERMINATED) {
            throw new VaultException(ErrorKind.SESSION_TERMINATED, "Session has been terminated.");
        }
    }

    private void requireUnlocked() throws VaultException {
        requireNotTerminated();
        if (state == State.UNINITIALIZED) {
            throw new VaultException(ErrorKind.VAULT_NOT_INITIALIZED, "No master password has been set.");
        }
        if (state != State.UNLOCKED) {
            throw new VaultException(ErrorKind.VAULT_LOCKED, "Vault is locked.");
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[VaultSession] " + message);
        }
    }

    private void warn(String message) {
        if (logger != null) {
            logger.warn("[VaultSession] " + message);
        }
    }

    private void error(String message, Throwable t) {
        if (logger == null) {
            return;
        }
        if (t != null) {
            logger.error("[VaultSession] " + message, t);
        } else {
            logger.error("[VaultSession] " + message);
        }
    }
}
