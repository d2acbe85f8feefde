package com.gazetteindex.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazetteindex.storage.PostingList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShardSplitterTest {

    @TempDir
    Path tempDir;

    @Test
    void testSplitTwoLevelAndWriteMeta() throws Exception {
        Path monolithic = tempDir.resolve("comp_code.json");
        Files.writeString(monolithic, "{\"5\":[0,1,2],\"300\":[4],\"-2\":[7,9]}");
        Path outputDirectory = tempDir.resolve("index_sharded").resolve("comp_code");

        ShardMeta meta = new ShardSplitter(monolithic, outputDirectory, true).split();

        assertEquals(3, meta.keys());
        assertEquals(6, meta.postingsTotal());
        assertEquals("[0,1,2]", Files.readString(outputDirectory.resolve("05").resolve("5.json")));
        assertEquals("[4]", Files.readString(outputDirectory.resolve("2c").resolve("300.json")));
        assertEquals("[7,9]", Files.readString(outputDirectory.resolve("fe").resolve("-2.json")));

        ShardMeta written = new ObjectMapper().readValue(outputDirectory.resolve("_meta.json").toFile(), ShardMeta.class);
        assertEquals(meta, written);
        assertTrue(Files.readString(outputDirectory.resolve("_meta.json")).contains("\"postings_total\""));
    }

    @Test
    void testSplitShardsAreReadableByIndexStore() throws Exception {
        Path indexRoot = tempDir.resolve("index");
        Path shardsRoot = tempDir.resolve("index_sharded");
        Files.createDirectories(indexRoot);
        Path monolithic = indexRoot.resolve("loc_id.json");
        Files.writeString(monolithic, "{\"1\":[0,2],\"2\":[1]}");

        new ShardSplitter(monolithic, shardsRoot.resolve("loc_id"), false).split();
        Files.delete(monolithic);

        IndexStore indexStore = new IndexStore(shardsRoot, indexRoot, 2);
        assertEquals(PostingList.of(0, 2), indexStore.postings("loc_id", 1));
        assertEquals(0, indexStore.cachedMonolithicCount());
    }

    @Test
    void testExistingShardsAreKept() throws Exception {
        Path monolithic = tempDir.resolve("type_id.json");
        Files.writeString(monolithic, "{\"3\":[1,2]}");
        Path outputDirectory = tempDir.resolve("type_id");
        Files.createDirectories(outputDirectory);
        Files.writeString(outputDirectory.resolve("3.json"), "[1,2]");
        long before = Files.getLastModifiedTime(outputDirectory.resolve("3.json")).toMillis();

        ShardMeta meta = new ShardSplitter(monolithic, outputDirectory, false).split();

        assertEquals(1, meta.keys());
        assertEquals(before, Files.getLastModifiedTime(outputDirectory.resolve("3.json")).toMillis());
    }

    @Test
    void testInvalidInputs() throws IOException {
        Path outputDirectory = tempDir.resolve("out");
        assertThrows(NoSuchFileException.class,
            () -> new ShardSplitter(tempDir.resolve("missing.json"), outputDirectory, true).split());

        Path arrayTop = tempDir.resolve("array.json");
        Files.writeString(arrayTop, "[1,2]");
        assertThrows(IOException.class, () -> new ShardSplitter(arrayTop, outputDirectory, true).split());

        Path badKey = tempDir.resolve("bad-key.json");
        Files.writeString(badKey, "{\"abc\":[1]}");
        assertThrows(IOException.class, () -> new ShardSplitter(badKey, outputDirectory, true).split());

        Path unsorted = tempDir.resolve("unsorted.json");
        Files.writeString(unsorted, "{\"1\":[3,1]}");
        assertThrows(IOException.class, () -> new ShardSplitter(unsorted, outputDirectory, true).split());
    }
}
