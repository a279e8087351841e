package com.tokenx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.SessionSettingsStore.SessionSettings;
import com.tokenx.vault.VaultKeySource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SessionSettingsStoreTest {

    @TempDir
    Path vaultDir;

    private SessionSettingsStore store() {
        return new SessionSettingsStore(vaultDir, new ObjectMapper());
    }

    @Test
    void missingFileYieldsDefaults() {
        SessionSettings settings = store().loadOrDefault(null);

        assertEquals(180, settings.getIdleTimeoutSecs());
        assertEquals(1000, settings.getRefreshIntervalMs());
        assertEquals(10_000, settings.getIdleCheckIntervalMs());
        assertEquals(2000, settings.getImportScanIntervalMs());
        assertEquals(VaultKeySource.PASSWORD, settings.resolveKeySource());
        assertTrue(settings.isClipboardImport());
    }

    @Test
    void saveThenLoad() {
        SessionSettings settings = new SessionSettings();
        settings.setIdleTimeoutSecs(60);
        settings.setVaultKeySource("master-secret");
        settings.setClipboardImport(false);
        store().save(settings);

        SessionSettings loaded = store().loadOrDefault(new SessionSettings());

        assertEquals(60, loaded.getIdleTimeoutSecs());
        assertEquals(VaultKeySource.MASTER_SECRET, loaded.resolveKeySource());
        assertFalse(loaded.isClipboardImport());
    }

    @Test
    void invalidValuesFallBackPerField() throws Exception {
        Files.writeString(vaultDir.resolve(SessionSettingsStore.SETTINGS_FILE),
            "{\"idleTimeoutSecs\":0,\"refreshIntervalMs\":250,\"vaultKeySource\":\"hsm\",\"unknown\":true}");

        SessionSettings loaded = store().loadOrDefault(new SessionSettings());

        assertEquals(180, loaded.getIdleTimeoutSecs());
        assertEquals(250, loaded.getRefreshIntervalMs());
        assertEquals("password", loaded.getVaultKeySource());
    }

    @Test
    void unreadableFileYieldsDefaults() throws Exception {
        Files.writeString(vaultDir.resolve(SessionSettingsStore.SETTINGS_FILE), "{not json");

        assertEquals(180, store().loadOrDefault(new SessionSettings()).getIdleTimeoutSecs());
    }

    @Test
    void keySourceAcceptsConfigSpellings() {
        assertEquals(VaultKeySource.MASTER_SECRET, VaultKeySource.fromConfig("MASTER_SECRET"));
        assertEquals(VaultKeySource.PASSWORD, VaultKeySource.fromConfig("Password"));
        assertNull(VaultKeySource.fromConfig("hsm"));
    }
}
