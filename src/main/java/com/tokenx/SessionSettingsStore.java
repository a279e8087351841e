package com.tokenx;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.crypto.KeyDerivation;
import com.tokenx.security.PasswordStrength;
import com.tokenx.vault.VaultKeySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists session timing and vault settings as settings.json next to the vault files.
 */
public class SessionSettingsStore {

    public static final String SETTINGS_FILE = "settings.json";

    private final Path settingsPath;
    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public SessionSettingsStore(Path vaultDir, ObjectMapper mapper) {
        this.settingsPath = vaultDir.resolve(SETTINGS_FILE);
        this.mapper = mapper;
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    public SessionSettings loadOrDefault(SessionSettings defaults) {
        SessionSettings base = defaults != null ? defaults : new SessionSettings();
        if (!Files.exists(settingsPath)) {
            return base;
        }

        try {
            SessionSettings stored = mapper.readValue(settingsPath.toFile(), SessionSettings.class);
            return merge(base, stored);
        } catch (Exception e) {
            logWarn("Failed to load session settings, using defaults: " + e.getMessage());
            return base;
        }
    }

    public void save(SessionSettings settings) {
        if (settings == null) return;
        try {
            if (settingsPath.getParent() != null) {
                Files.createDirectories(settingsPath.getParent());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(settingsPath.toFile(), settings);
            log("Saved session settings to " + settingsPath.getFileName());
        } catch (IOException e) {
            logWarn("Failed to save session settings: " + e.getMessage());
        }
    }

    private SessionSettings merge(SessionSettings base, SessionSettings stored) {
        if (stored == null) {
            return base;
        }

        SessionSettings result = new SessionSettings();
        result.setIdleTimeoutSecs(positiveOrDefault("idleTimeoutSecs",
            stored.getIdleTimeoutSecs(), base.getIdleTimeoutSecs()));
        result.setRefreshIntervalMs(positiveOrDefault("refreshIntervalMs",
            stored.getRefreshIntervalMs(), base.getRefreshIntervalMs()));
        result.setIdleCheckIntervalMs(positiveOrDefault("idleCheckIntervalMs",
            stored.getIdleCheckIntervalMs(), base.getIdleCheckIntervalMs()));
        result.setImportScanIntervalMs(positiveOrDefault("importScanIntervalMs",
            stored.getImportScanIntervalMs(), base.getImportScanIntervalMs()));
        result.setMinPasswordLength((int) positiveOrDefault("minPasswordLength",
            stored.getMinPasswordLength(), base.getMinPasswordLength()));
        result.setKdfIterations((int) positiveOrDefault("kdfIterations",
            stored.getKdfIterations(), base.getKdfIterations()));
        if (VaultKeySource.fromConfig(stored.getVaultKeySource()) != null) {
            result.setVaultKeySource(stored.getVaultKeySource());
        } else {
            logWarn("Unknown vaultKeySource '" + stored.getVaultKeySource() + "', using "
                + base.getVaultKeySource());
            result.setVaultKeySource(base.getVaultKeySource());
        }
        result.setClipboardImport(stored.isClipboardImport());
        return result;
    }

    private long positiveOrDefault(String field, long stored, long fallback) {
        if (stored > 0) {
            return stored;
        }
        logWarn("Invalid " + field + " (" + stored + "), using " + fallback);
        return fallback;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[SessionSettingsStore] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[SessionSettingsStore] " + message);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionSettings {
        private long idleTimeoutSecs = 180;
        private long refreshIntervalMs = 1000;
        private long idleCheckIntervalMs = 10_000;
        private long importScanIntervalMs = 2000;
        private int minPasswordLength = PasswordStrength.DEFAULT_MIN_LENGTH;
        private int kdfIterations = KeyDerivation.DEFAULT_ITERATIONS;
        private String vaultKeySource = VaultKeySource.PASSWORD.getConfigName();
        private boolean clipboardImport = true;

        public long getIdleTimeoutSecs() {
            return idleTimeoutSecs;
        }

        public void setIdleTimeoutSecs(long idleTimeoutSecs) {
            this.idleTimeoutSecs = idleTimeoutSecs;
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }

        public long getIdleCheckIntervalMs() {
            return idleCheckIntervalMs;
        }

        public void setIdleCheckIntervalMs(long idleCheckIntervalMs) {
            this.idleCheckIntervalMs = idleCheckIntervalMs;
        }

        public long getImportScanIntervalMs() {
            return importScanIntervalMs;
        }

        public void setImportScanIntervalMs(long importScanIntervalMs) {
            this.importScanIntervalMs = importScanIntervalMs;
        }

        public int getMinPasswordLength() {
            return minPasswordLength;
        }

        public void setMinPasswordLength(int minPasswordLength) {
            this.minPasswordLength = minPasswordLength;
        }

        public int getKdfIterations() {
            return kdfIterations;
        }

        public void setKdfIterations(int kdfIterations) {
            this.kdfIterations = kdfIterations;
        }

        public String getVaultKeySource() {
            return vaultKeySource;
        }

        public void setVaultKeySource(String vaultKeySource) {
            this.vaultKeySource = vaultKeySource;
        }

        public boolean isClipboardImport() {
            return clipboardImport;
        }

        public void setClipboardImport(boolean clipboardImport) {
            this.clipboardImport = clipboardImport;
        }

        @JsonIgnore
        public VaultKeySource resolveKeySource() {
            VaultKeySource source = VaultKeySource.fromConfig(vaultKeySource);
            return source != null ? source : VaultKeySource.PASSWORD;
        }
    }
}
