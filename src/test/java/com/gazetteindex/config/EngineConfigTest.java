package com.gazetteindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNotNull(config);
        assertEquals(Path.of("./data"), config.getDataRoot());
        assertEquals(Path.of("./data/docmeta/docmeta.bin"), config.getRowStorePath());
        assertEquals(Path.of("./data/index"), config.getIndexRoot());
        assertEquals(Path.of("./data/index_sharded"), config.getShardsRoot());
        assertEquals(Constants.DEFAULT_SEARCH_LIMIT, config.getDefaultLimit());
        assertEquals(Constants.MAX_SEARCH_LIMIT, config.getMaxLimit());
        assertEquals(Constants.SELECTIVITY_MULTIPLIER, config.getSelectivityMultiplier());
        assertEquals(Constants.MONOLITHIC_CACHE_SIZE, config.getMonolithicCacheSize());
        assertTrue(config.isEagerOpen());
    }

    @Test
    void testSetters() {
        EngineConfig config = new EngineConfig();
        Path rowStore = Path.of("./custom/rows.bin");

        config.setRowStorePath(rowStore);
        config.setDefaultLimit(10);
        config.setMaxLimit(50);
        config.setSelectivityMultiplier(8);
        config.setMonolithicCacheSize(2);
        config.setEagerOpen(false);

        assertEquals(rowStore, config.getRowStorePath());
        assertEquals(10, config.getDefaultLimit());
        assertEquals(50, config.getMaxLimit());
        assertEquals(8, config.getSelectivityMultiplier());
        assertEquals(2, config.getMonolithicCacheSize());
        assertEquals(false, config.isEagerOpen());
    }

    @Test
    void testFromEnvironmentDerivesPathsFromProjectRoot() {
        EngineConfig config = EngineConfig.fromEnvironment(Map.of(EngineConfig.ENV_PROJECT_ROOT, tempDir.toString()));

        Path dataRoot = tempDir.toAbsolutePath().resolve("data");
        assertEquals(dataRoot, config.getDataRoot());
        assertEquals(dataRoot.resolve("index"), config.getIndexRoot());
        assertEquals(dataRoot.resolve("index_sharded"), config.getShardsRoot());
        assertEquals(dataRoot.resolve("docmeta").resolve("docmeta.bin"), config.getRowStorePath());
    }

    @Test
    void testFromEnvironmentExplicitVariablesWin() {
        Path shards = tempDir.resolve("shards");
        Path rows = tempDir.resolve("rows.bin");
        EngineConfig config = EngineConfig.fromEnvironment(Map.of(
            EngineConfig.ENV_DATA_ROOT, tempDir.resolve("d").toString(),
            EngineConfig.ENV_SHARDS_ROOT, shards.toString(),
            EngineConfig.ENV_ROW_STORE, rows.toString(),
            EngineConfig.ENV_INDEX_ROOT, "  "));

        assertEquals(tempDir.resolve("d").toAbsolutePath(), config.getDataRoot());
        assertEquals(tempDir.resolve("d").resolve("index").toAbsolutePath(), config.getIndexRoot());
        assertEquals(shards.toAbsolutePath(), config.getShardsRoot());
        assertEquals(rows.toAbsolutePath(), config.getRowStorePath());
    }
}
