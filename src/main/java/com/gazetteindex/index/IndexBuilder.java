package com.gazetteindex.index;

import com.gazetteindex.config.Constants;
import com.gazetteindex.storage.PostingList;
import com.gazetteindex.storage.RowField;
import com.gazetteindex.storage.RowStore;
import com.gazetteindex.storage.StorageFileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 离线索引构建：单遍扫描行存，按字段值把行号分桶，再写出分片文件和/或整体索引。
 *
 * <p>可续跑：已存在的输出文件一律跳过，每个文件都经临时文件原子重命名写出，
 * 因此中断后目录里只有完整文件（外加可能残留的 .tmp），重新执行即可补齐缺失的键。
 */
public final class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    /** 扫描阶段检查中断标志的间隔（行） */
    private static final int INTERRUPT_CHECK_ROWS = 4096;

    private final RowStore rowStore;

    public IndexBuilder(RowStore rowStore) {
        if (rowStore == null) {
            throw new IllegalArgumentException("行存不能为空");
        }
        this.rowStore = rowStore;
    }

    /**
     * 执行一次构建。
     *
     * @param options 构建选项
     * @return 构建统计
     * @throws IOException 写出失败时抛出，已写出的文件保持完整
     * @throws InterruptedException 线程被中断时抛出，已写出的文件保持完整
     */
    public BuildReport build(BuildOptions options) throws IOException, InterruptedException {
        options.validate();
        long start = System.currentTimeMillis();
        String indexName = options.getIndexName();
        logger.info("开始构建索引: index={}, field={}, twoLevel={}, shards={}, monolithic={}, sample={}",
            indexName, options.getField(), options.isTwoLevel(), options.isWriteShards(),
            options.isWriteMonolithic(), options.getSampleRows());

        int rowsToScan = options.getSampleRows() > 0
            ? Math.min(options.getSampleRows(), rowStore.rowCount())
            : rowStore.rowCount();
        SortedMap<Integer, PostingList> buckets = scan(options.getField(), rowsToScan, options.getProgressRows());

        WriteStats stats = new WriteStats();
        if (options.isWriteShards()) {
            writeShards(indexName, options.shardLayout(), buckets, options.getProgressFiles(), stats);
        }
        boolean monolithicWritten = false;
        if (options.isWriteMonolithic()) {
            monolithicWritten = writeMonolithic(indexName, options.getIndexRoot(), buckets, stats);
        }

        BuildReport report = new BuildReport(indexName, rowsToScan, buckets.size(), stats.filesWritten,
            stats.filesSkipped, stats.bytesWritten, monolithicWritten, System.currentTimeMillis() - start);
        logger.info("索引构建完成: {}", report);
        return report;
    }

    /**
     * 扫描前 rowsToScan 行并按字段值分桶。行号递增到达，每个桶天然有序。
     */
    SortedMap<Integer, PostingList> scan(RowField field, int rowsToScan, int progressRows) throws InterruptedException {
        long start = System.nanoTime();
        Map<Integer, RowIdBucket> buckets = new HashMap<>();
        for (int rowId = 0; rowId < rowsToScan; rowId++) {
            if (rowId % INTERRUPT_CHECK_ROWS == 0 && Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("扫描被中断: rowId=" + rowId);
            }
            int key = rowStore.getField(rowId, field);
            buckets.computeIfAbsent(key, ignored -> new RowIdBucket()).add(rowId);
            if (progressRows > 0 && (rowId + 1) % progressRows == 0) {
                double elapsedSeconds = (System.nanoTime() - start) / 1e9;
                logger.info("[scan] {}/{} 行 | {} 行/秒", rowId + 1, rowsToScan,
                    elapsedSeconds > 0 ? Math.round((rowId + 1) / elapsedSeconds) : 0);
            }
        }
        SortedMap<Integer, PostingList> sorted = new TreeMap<>();
        for (Map.Entry<Integer, RowIdBucket> entry : buckets.entrySet()) {
            sorted.put(entry.getKey(), entry.getValue().toPostingList());
        }
        logger.info("[scan] 完成: {} 行 → {} 个不同键, 用时 {}ms", rowsToScan, sorted.size(),
            (System.nanoTime() - start) / 1_000_000);
        return sorted;
    }

    private void writeShards(
            String indexName,
            ShardLayout layout,
            SortedMap<Integer, PostingList> buckets,
            int progressFiles,
            WriteStats stats) throws IOException, InterruptedException {
        prepareShardDirectories(indexName, layout);
        long start = System.currentTimeMillis();
        int total = buckets.size();
        int processed = 0;
        for (Map.Entry<Integer, PostingList> entry : buckets.entrySet()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("分片写出被中断: 已处理 " + processed + "/" + total + " 个键");
            }
            processed++;
            Path shardPath = layout.shardPath(indexName, entry.getKey());
            if (Files.exists(shardPath)) {
                stats.filesSkipped++;
                continue;
            }
            PostingList postingList = entry.getValue();
            stats.bytesWritten += StorageFileUtil.writeAtomically(shardPath,
                outputStream -> PostingsCodec.writeShard(outputStream, postingList));
            stats.filesWritten++;
            if (progressFiles > 0 && (processed % progressFiles == 0 || processed == total)) {
                logger.info("[write] {}/{} 个键 | 新文件 {} | 跳过 {} | {} 字节",
                    processed, total, stats.filesWritten, stats.filesSkipped, stats.bytesWritten);
            }
        }
        logger.info("[write] 分片写出完成: 新文件 {}, 跳过 {}, 用时 {}ms",
            stats.filesWritten, stats.filesSkipped, System.currentTimeMillis() - start);
    }

    /**
     * 预先创建分片目录；两级布局一次性创建 256 个子目录。
     */
    private void prepareShardDirectories(String indexName, ShardLayout layout) throws IOException {
        Path indexDirectory = layout.indexDirectory(indexName);
        Files.createDirectories(indexDirectory);
        if (layout.twoLevel()) {
            for (int fanout = 0; fanout < Constants.SHARD_FANOUT_DIRS; fanout++) {
                Files.createDirectories(indexDirectory.resolve(ShardLayout.fanoutDirectoryName(fanout)));
            }
        }
    }

    private boolean writeMonolithic(
            String indexName,
            Path indexRoot,
            SortedMap<Integer, PostingList> buckets,
            WriteStats stats) throws IOException, InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("整体索引写出前被中断");
        }
        Files.createDirectories(indexRoot);
        Path target = indexRoot.resolve(indexName + "." + Constants.INDEX_FILE_EXTENSION);
        if (Files.exists(target)) {
            logger.info("[mono] 整体索引已存在，跳过: {}", target);
            return false;
        }
        long start = System.currentTimeMillis();
        stats.bytesWritten += StorageFileUtil.writeAtomically(target,
            outputStream -> PostingsCodec.writeMonolithic(outputStream, buckets));
        logger.info("[mono] 整体索引写出完成: {} ({} 个键, {}ms)", target, buckets.size(),
            System.currentTimeMillis() - start);
        return true;
    }

    private static final class WriteStats {
        private int filesWritten;
        private int filesSkipped;
        private long bytesWritten;
    }

    /**
     * 可增长的行号数组。
     */
    private static final class RowIdBucket {
        private int[] rowIds = new int[4];
        private int size;

        void add(int rowId) {
            if (size == rowIds.length) {
                rowIds = Arrays.copyOf(rowIds, size * 2);
            }
            rowIds[size++] = rowId;
        }

        PostingList toPostingList() {
            int[] sorted = Arrays.copyOf(rowIds, size);
            Arrays.sort(sorted);
            return new PostingList(sorted);
        }
    }
}
