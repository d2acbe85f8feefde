package com.gazetteindex.index;

import com.gazetteindex.config.Constants;
import com.gazetteindex.storage.RowField;

import java.nio.file.Path;

/**
 * 索引构建选项
 *
 * 默认写出两级分片与整体索引，扫描全部行
 */
public class BuildOptions {
    private RowField field = RowField.COMPANY;
    private String indexName;
    private Path shardsRoot;
    private Path indexRoot;
    private boolean twoLevel = true;
    private boolean writeShards = true;
    private boolean writeMonolithic = true;
    private int sampleRows;
    private int progressRows = Constants.DEFAULT_SCAN_PROGRESS_ROWS;
    private int progressFiles = Constants.DEFAULT_WRITE_PROGRESS_FILES;

    public BuildOptions(Path shardsRoot, Path indexRoot) {
        this.shardsRoot = shardsRoot;
        this.indexRoot = indexRoot;
    }

    public RowField getField() {
        return field;
    }

    public BuildOptions setField(RowField field) {
        this.field = field;
        return this;
    }

    /**
     * 未显式指定时使用字段的默认索引名。
     */
    public String getIndexName() {
        return indexName == null || indexName.isBlank() ? field.indexName() : indexName;
    }

    public BuildOptions setIndexName(String indexName) {
        this.indexName = indexName;
        return this;
    }

    public Path getShardsRoot() {
        return shardsRoot;
    }

    public BuildOptions setShardsRoot(Path shardsRoot) {
        this.shardsRoot = shardsRoot;
        return this;
    }

    public Path getIndexRoot() {
        return indexRoot;
    }

    public BuildOptions setIndexRoot(Path indexRoot) {
        this.indexRoot = indexRoot;
        return this;
    }

    public boolean isTwoLevel() {
        return twoLevel;
    }

    public BuildOptions setTwoLevel(boolean twoLevel) {
        this.twoLevel = twoLevel;
        return this;
    }

    public boolean isWriteShards() {
        return writeShards;
    }

    public BuildOptions setWriteShards(boolean writeShards) {
        this.writeShards = writeShards;
        return this;
    }

    public boolean isWriteMonolithic() {
        return writeMonolithic;
    }

    public BuildOptions setWriteMonolithic(boolean writeMonolithic) {
        this.writeMonolithic = writeMonolithic;
        return this;
    }

    /**
     * 只扫描前 N 行，0 表示全部。
     */
    public int getSampleRows() {
        return sampleRows;
    }

    public BuildOptions setSampleRows(int sampleRows) {
        this.sampleRows = sampleRows;
        return this;
    }

    public int getProgressRows() {
        return progressRows;
    }

    public BuildOptions setProgressRows(int progressRows) {
        this.progressRows = progressRows;
        return this;
    }

    public int getProgressFiles() {
        return progressFiles;
    }

    public BuildOptions setProgressFiles(int progressFiles) {
        this.progressFiles = progressFiles;
        return this;
    }

    public ShardLayout shardLayout() {
        return new ShardLayout(shardsRoot, twoLevel);
    }

    void validate() {
        if (field == null) {
            throw new IllegalArgumentException("分桶字段不能为空");
        }
        if (!writeShards && !writeMonolithic) {
            throw new IllegalArgumentException("分片与整体索引至少需要写出一种");
        }
        if (writeShards && shardsRoot == null) {
            throw new IllegalArgumentException("分片根目录不能为空");
        }
        if (writeMonolithic && indexRoot == null) {
            throw new IllegalArgumentException("整体索引根目录不能为空");
        }
        if (sampleRows < 0) {
            throw new IllegalArgumentException("采样行数不能为负数: " + sampleRows);
        }
    }
}
