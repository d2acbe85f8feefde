package com.gazetteindex.index;

import com.gazetteindex.config.EngineConfig;
import com.gazetteindex.storage.PostingList;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 倒排索引读取入口。
 *
 * <p>解析顺序：两级分片 → 单级分片 → 整体索引（带缓存）。任何一层缺失都不是错误，
 * 最终找不到键时返回空列表；文件存在但内容非法时抛出 {@link IOException}。
 */
public class IndexStore implements PostingsSource {
    private final ShardLayout shardLayout;
    private final MonolithicIndexCache monolithicCache;

    /**
     * 按配置中的分片根目录、整体索引根目录与缓存容量创建。
     */
    public IndexStore(EngineConfig config) {
        this(config.getShardsRoot(), config.getIndexRoot(), config.getMonolithicCacheSize());
    }

    public IndexStore(Path shardsRoot, Path indexRoot, int monolithicCacheSize) {
        this.shardLayout = new ShardLayout(shardsRoot, true);
        this.monolithicCache = new MonolithicIndexCache(indexRoot, monolithicCacheSize);
    }

    @Override
    public PostingList postings(String indexName, int key) throws IOException {
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("索引名不能为空");
        }
        PostingList fromShard = readShardIfPresent(shardLayout.twoLevelPath(indexName, key));
        if (fromShard != null) {
            return fromShard;
        }
        fromShard = readShardIfPresent(shardLayout.singleLevelPath(indexName, key));
        if (fromShard != null) {
            return fromShard;
        }
        Map<String, int[]> monolithic = monolithicCache.get(indexName);
        int[] rowIds = monolithic.get(String.valueOf(key));
        if (rowIds == null) {
            return PostingList.EMPTY;
        }
        return PostingsCodec.toPostingList(rowIds, monolithicCache.pathFor(indexName));
    }

    /**
     * 已缓存的整体索引数量。
     */
    public long cachedMonolithicCount() {
        return monolithicCache.estimatedSize();
    }

    private PostingList readShardIfPresent(Path shardFile) throws IOException {
        if (!Files.isRegularFile(shardFile)) {
            return null;
        }
        return PostingsCodec.readShard(shardFile);
    }
}
