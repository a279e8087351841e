package com.tokenx.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.crypto.CryptoEnvelope;
import com.tokenx.crypto.KeyDerivation;
import com.tokenx.models.Credential;
import com.tokenx.models.OtpAlgorithm;
import com.tokenx.storage.FileStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class VaultStoreTest {

    private static final String OLD_KEY = "old-Passw0rd!";
    private static final String NEW_KEY = "new-Passw0rd!";

    @TempDir
    Path tempDir;

    private Path vaultDir;
    private CryptoEnvelope envelope;
    private VaultStore store;

    @BeforeEach
    void setUp() throws Exception {
        vaultDir = tempDir.resolve("nested").resolve("vault");
        envelope = new CryptoEnvelope(KeyDerivation.PBKDF2_SHA256, 1_000);
        store = VaultStore.open(vaultDir, envelope);
    }

    private static Credential totp(String label) {
        return Credential.totp(label, "JBSWY3DPEHPK3PXP", "Issuer", OtpAlgorithm.SHA1, 6, 30);
    }

    @Test
    void openCreatesDirectory() {
        assertTrue(Files.isDirectory(vaultDir));
    }

    @Test
    void saveThenLoadRoundTrips() throws Exception {
        Credential hotp = Credential.hotp("ops", "GEZDGNBVGY3TQOJQ", "Svc", OtpAlgorithm.SHA256, 8, 7L);

        store.save("ops", hotp, OLD_KEY);

        assertTrue(store.exists("ops"));
        assertEquals(Optional.of(hotp), store.load("ops", OLD_KEY));
        String stored = Files.readString(store.pathFor("ops"), StandardCharsets.US_ASCII);
        assertFalse(stored.contains("GEZDGNBVGY3TQOJQ"));
    }

    @Test
    void loadWithWrongKeyIsEmpty() throws Exception {
        store.save("me", totp("me"), OLD_KEY);

        assertEquals(Optional.empty(), store.load("me", NEW_KEY));
        assertEquals(Optional.empty(), store.load("missing", OLD_KEY));
    }

    @Test
    void loadAcceptsLegacyStringNumbersAndRawEnvelopes() throws Exception {
        String json = "{\"type\":\"totp\",\"label\":\"legacy\",\"secret\":\"JBSWY3DPEHPK3PXP\","
            + "\"issuer\":\"Old\",\"algorithm\":\"SHA1\",\"digits\":\"8\",\"period\":\"60\"}";
        Files.write(store.pathFor("legacy"),
            envelope.encrypt(json.getBytes(StandardCharsets.UTF_8), OLD_KEY).toBytes());

        Credential loaded = store.load("legacy", OLD_KEY).orElseThrow();

        assertEquals(8, loaded.getDigits());
        assertEquals(60, loaded.getPeriod());
        assertEquals("Old", loaded.getIssuer());
    }

    @Test
    void loadAllSummarizesFailuresPerFile() throws Exception {
        store.save("a", totp("a"), OLD_KEY);
        store.save("b", totp("b"), OLD_KEY);
        store.save("c", totp("c"), "someone-else");
        Files.writeString(store.pathFor("garbage"), "not an envelope");
        Files.writeString(vaultDir.resolve(".master"), "ignored");

        VaultLoadSummary summary = store.loadAll(OLD_KEY);

        assertEquals(List.of("a", "b"), List.copyOf(summary.getLoaded().keySet()));
        assertEquals(List.of("c", "garbage"), summary.getFailed());
    }

    @Test
    void listDeleteAndReset() throws Exception {
        store.save("b", totp("b"), OLD_KEY);
        store.save("a", totp("a"), OLD_KEY);

        assertEquals(List.of("a", "b"), store.listNames());
        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(List.of("b"), store.listNames());

        store.save("c", totp("c"), OLD_KEY);
        assertEquals(2, store.resetAll());
        assertTrue(store.listNames().isEmpty());
    }

    @Test
    void rejectsPathLikeNames() {
        VaultException e = assertThrows(VaultException.class, () -> store.save("../x", totp("x"), OLD_KEY));
        assertEquals(ErrorKind.CREDENTIAL_NOT_FOUND, e.getKind());
    }

    @Test
    void reencryptAllMovesEveryFileToNewKey() throws Exception {
        for (String name : List.of("a", "b", "c")) {
            store.save(name, totp(name), OLD_KEY);
        }

        ReencryptionResult result = store.reencryptAll(OLD_KEY, NEW_KEY);

        assertTrue(result.isCommitted());
        assertEquals(List.of("a", "b", "c"), result.getSucceeded());
        assertTrue(result.getFailed().isEmpty());
        for (String name : List.of("a", "b", "c")) {
            assertEquals(Optional.of(totp(name)), store.load(name, NEW_KEY));
            assertEquals(Optional.empty(), store.load(name, OLD_KEY));
        }
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void reencryptAllWritesNothingWhenAnyFileFails() throws Exception {
        for (String name : List.of("a", "b", "c")) {
            store.save(name, totp(name), OLD_KEY);
        }
        store.save("d", totp("d"), "other-Passw0rd!");
        store.save("e", totp("e"), "other-Passw0rd!");
        Map<String, byte[]> before = snapshot();

        ReencryptionResult result = store.reencryptAll(OLD_KEY, NEW_KEY);

        assertFalse(result.isCommitted());
        assertEquals(3, result.getSucceeded().size());
        assertEquals(List.of("d", "e"), result.getFailed());
        Map<String, byte[]> after = snapshot();
        assertEquals(before.keySet(), after.keySet());
        for (String name : before.keySet()) {
            assertArrayEquals(before.get(name), after.get(name), name);
        }
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void stagingFailureRemovesTempsAndKeepsOriginals() throws Exception {
        store.save("a", totp("a"), OLD_KEY);
        store.save("b", totp("b"), OLD_KEY);
        // a directory in the temp file's place makes the staged write fail
        Files.createDirectory(vaultDir.resolve("b.enc.tmp"));

        VaultException e = assertThrows(VaultException.class, () -> store.reencryptAll(OLD_KEY, NEW_KEY));

        assertEquals(ErrorKind.IO_FAILURE, e.getKind());
        assertEquals(Optional.of(totp("a")), store.load("a", OLD_KEY));
        assertEquals(Optional.of(totp("b")), store.load("b", OLD_KEY));
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void longestSanitizedLabelSavesAndLoads() throws Exception {
        String label = "a".repeat(300);
        String name = VaultFileNames.sanitize(label);

        store.save(name, totp(label), OLD_KEY);

        assertEquals(Optional.of(totp(label)), store.load(name, OLD_KEY));
        ReencryptionResult result = store.reencryptAll(OLD_KEY, NEW_KEY);
        assertTrue(result.isCommitted());
        assertEquals(Optional.of(totp(label)), store.load(name, NEW_KEY));
    }

    @Test
    void failedRenameRestoresCommittedFilesToOldKey() throws Exception {
        AtomicInteger commits = new AtomicInteger();
        VaultStore failing = VaultStore.open(vaultDir, envelope, new ObjectMapper(), (temp, target) -> {
            if (commits.incrementAndGet() == 2) {
                throw new IOException("rename refused");
            }
            FileStorage.commitTemp(temp, target);
        });
        for (String name : List.of("a", "b", "c")) {
            failing.save(name, totp(name), OLD_KEY);
        }

        VaultException e = assertThrows(VaultException.class, () -> failing.reencryptAll(OLD_KEY, NEW_KEY));

        assertEquals(ErrorKind.IO_FAILURE, e.getKind());
        for (String name : List.of("a", "b", "c")) {
            assertEquals(Optional.of(totp(name)), failing.load(name, OLD_KEY), name);
        }
        assertTrue(tempFiles().isEmpty());
    }

    private Map<String, byte[]> snapshot() throws Exception {
        Map<String, byte[]> files = new HashMap<>();
        for (String name : store.listNames()) {
            files.put(name, Files.readAllBytes(store.pathFor(name)));
        }
        return files;
    }

    private List<String> tempFiles() throws Exception {
        try (Stream<Path> entries = Files.list(vaultDir)) {
            return entries.map(p -> p.getFileName().toString())
                .filter(n -> n.endsWith(".tmp"))
                .collect(Collectors.toList());
        }
    }
}
