package com.gazetteindex.index;

import com.gazetteindex.config.Constants;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 整体索引文件缓存，按索引名缓存已解析的映射，容量有界。
 *
 * <p>缓存内容在实例生命周期内不失效；重新构建的整体索引需要新的实例才能看到。
 */
final class MonolithicIndexCache {
    private static final Logger logger = LoggerFactory.getLogger(MonolithicIndexCache.class);

    private final Path indexRoot;
    private final Cache<String, Map<String, int[]>> cache;

    MonolithicIndexCache(Path indexRoot, int maximumSize) {
        if (indexRoot == null) {
            throw new IllegalArgumentException("索引根目录不能为空");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正数: " + maximumSize);
        }
        this.indexRoot = indexRoot;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .build();
    }

    /**
     * 整体索引文件路径：&lt;indexRoot&gt;/&lt;index&gt;.json
     */
    Path pathFor(String indexName) {
        return indexRoot.resolve(indexName + "." + Constants.INDEX_FILE_EXTENSION);
    }

    /**
     * 返回索引映射；文件不存在时返回空映射（同样被缓存）。
     *
     * @param indexName 索引名
     * @return 字符串键到行号数组的映射
     * @throws IOException 文件存在但无法解析时抛出，失败结果不缓存
     */
    Map<String, int[]> get(String indexName) throws IOException {
        try {
            return cache.get(indexName, this::load);
        } catch (UncheckedIOException exception) {
            throw exception.getCause();
        }
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }

    private Map<String, int[]> load(String indexName) {
        Path file = pathFor(indexName);
        if (!Files.exists(file)) {
            logger.debug("整体索引不存在，按空索引处理: {}", file);
            return Map.of();
        }
        try {
            long start = System.currentTimeMillis();
            Map<String, int[]> mapping = PostingsCodec.readMonolithic(file);
            logger.info("整体索引已加载: {} ({} 个键, {}ms)", file, mapping.size(), System.currentTimeMillis() - start);
            return mapping;
        } catch (IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }
}
