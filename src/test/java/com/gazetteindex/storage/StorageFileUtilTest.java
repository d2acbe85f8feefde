package com.gazetteindex.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StorageFileUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testTempPathIsSibling() {
        Path target = tempDir.resolve("loc_id").resolve("17.json");
        assertEquals(tempDir.resolve("loc_id").resolve("17.json.tmp"), StorageFileUtil.tempPathFor(target));
    }

    @Test
    void testWriteAtomicallyReplacesTarget() throws IOException {
        Path target = tempDir.resolve("17.json");
        Files.writeString(target, "[1]");

        long bytes = StorageFileUtil.writeAtomically(target,
            outputStream -> outputStream.write("[1,2,3]".getBytes(StandardCharsets.UTF_8)));

        assertEquals(7, bytes);
        assertEquals("[1,2,3]", Files.readString(target));
        assertFalse(Files.exists(StorageFileUtil.tempPathFor(target)));
    }

    @Test
    void testFailedWriteLeavesTargetUntouched() throws IOException {
        Path target = tempDir.resolve("17.json");
        Files.writeString(target, "[1]");

        IOException exception = assertThrows(IOException.class, () -> StorageFileUtil.writeAtomically(target, outputStream -> {
            outputStream.write("[9,".getBytes(StandardCharsets.UTF_8));
            throw new IOException("磁盘已满");
        }));

        assertEquals("磁盘已满", exception.getCause().getMessage());
        assertEquals("[1]", Files.readString(target));
        assertFalse(Files.exists(StorageFileUtil.tempPathFor(target)));
    }
}
