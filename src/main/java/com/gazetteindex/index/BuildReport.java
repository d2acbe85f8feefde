package com.gazetteindex.index;

/**
 * 索引构建结果统计。
 *
 * @param indexName 索引名
 * @param rowsScanned 扫描行数
 * @param distinctKeys 不同键数量
 * @param filesWritten 本次新写出的分片文件数
 * @param filesSkipped 已存在而跳过的分片文件数
 * @param bytesWritten 本次写出的字节数（分片与整体索引合计）
 * @param monolithicWritten 本次是否写出了整体索引
 * @param elapsedMs 耗时（毫秒）
 */
public record BuildReport(
        String indexName,
        int rowsScanned,
        int distinctKeys,
        int filesWritten,
        int filesSkipped,
        long bytesWritten,
        boolean monolithicWritten,
        long elapsedMs
) {
}
