package com.gazetteindex.index;

import com.gazetteindex.config.Constants;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 分片目录布局。
 *
 * <pre>
 * 单级: &lt;shardsRoot&gt;/&lt;index&gt;/&lt;key&gt;.json
 * 两级: &lt;shardsRoot&gt;/&lt;index&gt;/&lt;hex(key &amp; 0xFF)&gt;/&lt;key&gt;.json
 * </pre>
 *
 * @param shardsRoot 分片根目录
 * @param twoLevel 是否按 key 低 8 位再分一级目录
 */
public record ShardLayout(Path shardsRoot, boolean twoLevel) {

    public ShardLayout {
        if (shardsRoot == null) {
            throw new IllegalArgumentException("分片根目录不能为空");
        }
    }

    /**
     * 索引对应的分片目录。
     */
    public Path indexDirectory(String indexName) {
        return shardsRoot.resolve(indexName);
    }

    /**
     * 按当前布局计算分片文件路径。
     */
    public Path shardPath(String indexName, int key) {
        return twoLevel ? twoLevelPath(indexName, key) : singleLevelPath(indexName, key);
    }

    /**
     * 两级布局下的分片路径。
     */
    public Path twoLevelPath(String indexName, int key) {
        return indexDirectory(indexName).resolve(fanoutDirectoryName(key)).resolve(fileName(key));
    }

    /**
     * 单级布局下的分片路径。
     */
    public Path singleLevelPath(String indexName, int key) {
        return indexDirectory(indexName).resolve(fileName(key));
    }

    /**
     * 两级目录名：key 低 8 位的两位小写十六进制。
     */
    public static String fanoutDirectoryName(int key) {
        return String.format(Locale.ROOT, "%02x", key & Constants.SHARD_FANOUT_MASK);
    }

    private static String fileName(int key) {
        return key + "." + Constants.INDEX_FILE_EXTENSION;
    }
}
