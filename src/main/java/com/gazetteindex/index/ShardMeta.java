package com.gazetteindex.index;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 分片目录统计，写入 _meta.json。
 *
 * @param src 来源整体索引文件
 * @param keys 键数量
 * @param postingsTotal 全部倒排项数量
 */
public record ShardMeta(
        String src,
        int keys,
        @JsonProperty("postings_total") long postingsTotal
) {
}
