package com.tokenx.vault;

/**
 * Snapshot of the session for the display layer.
 */
public class SessionStatus {
    private String state;
    private boolean initialized;
    private int credentialCount;
    private long lastActivityAt;
    private long idleTimeoutSecs;
    private long idleSecondsRemaining;
    private String keySource;
    private String lastImportStatus;

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public int getCredentialCount() {
        return credentialCount;
    }

    public void setCredentialCount(int credentialCount) {
        this.credentialCount = credentialCount;
    }

    /**
     * Epoch millis of the last recorded activity, 0 when locked.
     */
    public long getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(long lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
    }

    public long getIdleTimeoutSecs() {
        return idleTimeoutSecs;
    }

    public void setIdleTimeoutSecs(long idleTimeoutSecs) {
        this.idleTimeoutSecs = idleTimeoutSecs;
    }

    public long getIdleSecondsRemaining() {
        return idleSecondsRemaining;
    }

    public void setIdleSecondsRemaining(long idleSecondsRemaining) {
        this.idleSecondsRemaining = idleSecondsRemaining;
    }

    public String getKeySource() {
        return keySource;
    }

    public void setKeySource(String keySource) {
        this.keySource = keySource;
    }

    public String getLastImportStatus() {
        return lastImportStatus;
    }

    public void setLastImportStatus(String lastImportStatus) {
        this.lastImportStatus = lastImportStatus;
    }
}
