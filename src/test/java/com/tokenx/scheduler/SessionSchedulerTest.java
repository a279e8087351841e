package com.tokenx.scheduler;

import com.tokenx.MutableClock;
import com.tokenx.SessionSettingsStore.SessionSettings;
import com.tokenx.crypto.CryptoEnvelope;
import com.tokenx.crypto.KeyDerivation;
import com.tokenx.otp.CodeGenerator;
import com.tokenx.otp.OtpUriParser;
import com.tokenx.qr.QrCodeService;
import com.tokenx.security.MasterKeyManager;
import com.tokenx.security.PasswordStrength;
import com.tokenx.vault.VaultKeySource;
import com.tokenx.vault.VaultSession;
import com.tokenx.vault.VaultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionSchedulerTest {

    private static final String PASSWORD = "Corr3ct#Horse";
    private static final String URI = "otpauth://totp/Svc:carol?secret=JBSWY3DPEHPK3PXP";

    @TempDir
    Path vaultDir;

    private final MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
    private VaultSession session;

    @BeforeEach
    void setUp() throws Exception {
        PasswordStrength strength = new PasswordStrength();
        CryptoEnvelope envelope = new CryptoEnvelope(KeyDerivation.PBKDF2_SHA256, 1_000);
        session = new VaultSession(VaultStore.open(vaultDir, envelope),
            new MasterKeyManager(vaultDir, envelope, strength), strength, new CodeGenerator(clock),
            new OtpUriParser(), new QrCodeService(), VaultKeySource.PASSWORD, Duration.ofSeconds(180), clock);
        session.setup(PASSWORD, PASSWORD);
    }

    private static class QueuedSource implements ImportSource {
        private final Deque<String> texts = new ArrayDeque<>();

        @Override
        public Optional<String> poll() {
            return Optional.ofNullable(texts.poll());
        }

        @Override
        public String getName() {
            return "queue";
        }
    }

    @Test
    void scanImportsOtpauthText() throws Exception {
        QueuedSource source = new QueuedSource();
        source.texts.add("hello");
        source.texts.add(URI);
        SessionScheduler scheduler = new SessionScheduler(session, source, new SessionSettings());

        scheduler.scanOnce();
        assertTrue(session.codes().isEmpty());

        scheduler.scanOnce();
        assertEquals("carol", session.codes().get(0).getName());

        scheduler.scanOnce();
        assertEquals(1, session.codes().size());
    }

    @Test
    void refreshUpdatesSnapshot() throws Exception {
        session.importUri(URI, false);
        SessionScheduler scheduler = new SessionScheduler(session, null, null);

        scheduler.refreshOnce();

        assertTrue(scheduler.getLastRefreshAt() > 0);
        assertEquals(1, session.getCodeSnapshot().size());
    }

    @Test
    void idleCheckLocksAfterTimeout() {
        SessionScheduler scheduler = new SessionScheduler(session, null, new SessionSettings());

        clock.advanceSeconds(179);
        scheduler.checkIdleOnce();
        assertEquals(VaultSession.State.UNLOCKED, session.getState());

        clock.advanceSeconds(1);
        scheduler.checkIdleOnce();
        assertEquals(VaultSession.State.LOCKED, session.getState());
    }

    @Test
    void failingSourceDoesNotStopScan() {
        ImportSource broken = new ImportSource() {
            @Override
            public Optional<String> poll() {
                throw new IllegalStateException("clipboard busy");
            }

            @Override
            public String getName() {
                return "broken";
            }
        };
        SessionScheduler scheduler = new SessionScheduler(session, broken, new SessionSettings());

        assertDoesNotThrow(scheduler::scanOnce);
    }

    @Test
    void startAndStop() {
        SessionSettings settings = new SessionSettings();
        settings.setRefreshIntervalMs(50);
        SessionScheduler scheduler = new SessionScheduler(session, new QueuedSource(), settings);

        scheduler.start();
        scheduler.stop();

        assertEquals(VaultSession.State.UNLOCKED, session.getState());
    }
}
