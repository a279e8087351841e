package com.tokenx.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileStorageTest {

    @TempDir
    Path dir;

    @Test
    void writeAtomicCreatesParentsAndReplaces() throws Exception {
        Path target = dir.resolve("a").resolve("b.enc");

        FileStorage.writeAtomic(target, "first");
        FileStorage.writeAtomic(target, "second");

        assertEquals("second", Files.readString(target));
        assertFalse(Files.exists(dir.resolve("a").resolve("b.enc.tmp")));
    }

    @Test
    void stagedWriteOnlyLandsOnCommit() throws Exception {
        Path target = dir.resolve("x.enc");
        FileStorage.writeAtomic(target, "old");

        Path temp = FileStorage.writeTemp(target, "new".getBytes());
        assertEquals("old", Files.readString(target));
        assertEquals("x.enc" + FileStorage.TEMP_SUFFIX, temp.getFileName().toString());

        FileStorage.commitTemp(temp, target);
        assertEquals("new", Files.readString(target));
        assertFalse(Files.exists(temp));
    }

    @Test
    void deleteQuietlyIgnoresMissingFiles() throws Exception {
        Path temp = FileStorage.writeTemp(dir.resolve("y.enc"), new byte[] {1});

        FileStorage.deleteQuietly(temp);
        FileStorage.deleteQuietly(temp);

        assertFalse(Files.exists(temp));
    }
}
