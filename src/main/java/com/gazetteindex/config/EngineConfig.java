package com.gazetteindex.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * 引擎运行时配置
 *
 * 支持从环境变量或CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    static final String ENV_PROJECT_ROOT = "PROJECT_ROOT";
    static final String ENV_DATA_ROOT = "DATA_ROOT";
    static final String ENV_INDEX_ROOT = "INDEX_ROOT";
    static final String ENV_SHARDS_ROOT = "SHARDS_ROOT";
    static final String ENV_ROW_STORE = "DOCMETA_BIN";

    private Path dataRoot = Paths.get("./data");
    private Path rowStorePath = dataRoot.resolve("docmeta").resolve(Constants.ROW_STORE_FILE_NAME);
    private Path indexRoot = dataRoot.resolve("index");
    private Path shardsRoot = dataRoot.resolve("index_sharded");
    private int defaultLimit = Constants.DEFAULT_SEARCH_LIMIT;
    private int maxLimit = Constants.MAX_SEARCH_LIMIT;
    private int selectivityMultiplier = Constants.SELECTIVITY_MULTIPLIER;
    private int monolithicCacheSize = Constants.MONOLITHIC_CACHE_SIZE;
    private boolean eagerOpen = true;

    public Path getDataRoot() {
        return dataRoot;
    }

    public void setDataRoot(Path dataRoot) {
        this.dataRoot = dataRoot;
    }

    public Path getRowStorePath() {
        return rowStorePath;
    }

    public void setRowStorePath(Path rowStorePath) {
        this.rowStorePath = rowStorePath;
    }

    public Path getIndexRoot() {
        return indexRoot;
    }

    public void setIndexRoot(Path indexRoot) {
        this.indexRoot = indexRoot;
    }

    public Path getShardsRoot() {
        return shardsRoot;
    }

    public void setShardsRoot(Path shardsRoot) {
        this.shardsRoot = shardsRoot;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getSelectivityMultiplier() {
        return selectivityMultiplier;
    }

    public void setSelectivityMultiplier(int selectivityMultiplier) {
        this.selectivityMultiplier = selectivityMultiplier;
    }

    public int getMonolithicCacheSize() {
        return monolithicCacheSize;
    }

    public void setMonolithicCacheSize(int monolithicCacheSize) {
        this.monolithicCacheSize = monolithicCacheSize;
    }

    public boolean isEagerOpen() {
        return eagerOpen;
    }

    public void setEagerOpen(boolean eagerOpen) {
        this.eagerOpen = eagerOpen;
    }

    /**
     * 将数据根目录下的默认路径统一指向新的根目录
     */
    public EngineConfig withDataRoot(Path newDataRoot) {
        this.dataRoot = newDataRoot;
        this.rowStorePath = newDataRoot.resolve("docmeta").resolve(Constants.ROW_STORE_FILE_NAME);
        this.indexRoot = newDataRoot.resolve("index");
        this.shardsRoot = newDataRoot.resolve("index_sharded");
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 按环境变量解析路径，未设置的变量回退到项目根目录下的默认布局
     */
    public static EngineConfig fromEnvironment(Map<String, String> environment) {
        Path projectRoot = pathOrDefault(environment, ENV_PROJECT_ROOT, Paths.get("").toAbsolutePath());
        Path dataRoot = pathOrDefault(environment, ENV_DATA_ROOT, projectRoot.resolve("data"));

        EngineConfig config = new EngineConfig().withDataRoot(dataRoot);
        config.setIndexRoot(pathOrDefault(environment, ENV_INDEX_ROOT, config.getIndexRoot()));
        config.setShardsRoot(pathOrDefault(environment, ENV_SHARDS_ROOT, config.getShardsRoot()));
        config.setRowStorePath(pathOrDefault(environment, ENV_ROW_STORE, config.getRowStorePath()));
        return config;
    }

    private static Path pathOrDefault(Map<String, String> environment, String name, Path fallback) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return fallback.toAbsolutePath().normalize();
        }
        return Paths.get(value.trim()).toAbsolutePath().normalize();
    }
}
