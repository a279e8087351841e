package com.tokenx.scheduler;

import com.tokenx.AppLogger;
import com.tokenx.SessionSettingsStore.SessionSettings;
import com.tokenx.vault.VaultSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Background triggers for the vault session: code refresh, idle check and import scan, all on one
 * daemon thread so they never run concurrently with each other.
 */
public class SessionScheduler {

    private final VaultSession session;
    private final ImportSource importSource;
    private final long refreshIntervalMs;
    private final long idleCheckIntervalMs;
    private final long importScanIntervalMs;
    private final ScheduledExecutorService executor;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final AppLogger logger = AppLogger.get();
    private volatile long lastRefreshAt = 0L;

    public SessionScheduler(VaultSession session, ImportSource importSource, SessionSettings settings) {
        this.session = Objects.requireNonNull(session, "session");
        this.importSource = importSource;
        SessionSettings config = settings != null ? settings : new SessionSettings();
        this.refreshIntervalMs = config.getRefreshIntervalMs();
        this.idleCheckIntervalMs = config.getIdleCheckIntervalMs();
        this.importScanIntervalMs = config.getImportScanIntervalMs();
        this.executor = Executors.newSingleThreadScheduledExecutor(sessionThreadFactory());
    }

    public synchronized void start() {
        futures.add(executor.scheduleAtFixedRate(this::refreshOnce, 0L, refreshIntervalMs, TimeUnit.MILLISECONDS));
        futures.add(executor.scheduleAtFixedRate(this::checkIdleOnce, idleCheckIntervalMs, idleCheckIntervalMs,
            TimeUnit.MILLISECONDS));
        if (importSource != null) {
            futures.add(executor.scheduleAtFixedRate(this::scanOnce, importScanIntervalMs, importScanIntervalMs,
                TimeUnit.MILLISECONDS));
        }
        log("Scheduled refresh every " + refreshIntervalMs + "ms, idle check every " + idleCheckIntervalMs + "ms"
            + (importSource != null
                ? ", " + importSource.getName() + " scan every " + importScanIntervalMs + "ms"
                : ", import scan disabled"));
    }

    public synchronized void stop() {
        futures.forEach(future -> future.cancel(false));
        futures.clear();
        executor.shutdownNow();
    }

    public long getLastRefreshAt() {
        return lastRefreshAt;
    }

    void refreshOnce() {
        try {
            session.refreshCodes();
            lastRefreshAt = System.currentTimeMillis();
        } catch (RuntimeException e) {
            logWarning("Code refresh failed: " + e.getMessage());
        }
    }

    void checkIdleOnce() {
        try {
            if (session.checkIdle()) {
                log("Idle timeout reached, session locked");
            }
        } catch (RuntimeException e) {
            logWarning("Idle check failed: " + e.getMessage());
        }
    }

    void scanOnce() {
        if (importSource == null) {
            return;
        }
        try {
            Optional<String> text = importSource.poll();
            text.flatMap(session::importScanned)
                .ifPresent(name -> log("Imported " + name + " from " + importSource.getName()));
        } catch (RuntimeException e) {
            logWarning("Import scan failed: " + e.getMessage());
        }
    }

    private ThreadFactory sessionThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "vault-session-scheduler");
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[SessionScheduler] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[SessionScheduler] " + message);
        }
    }
}
