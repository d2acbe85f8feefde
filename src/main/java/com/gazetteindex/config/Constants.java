package com.gazetteindex.config;

import java.time.LocalDate;

/**
 * 全局常量定义
 *
 * 包含行存格式、日期键编码、索引布局、查询参数和构建进度参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 行存格式 ====================
    /** 每行 int32 字段数 */
    public static final int ROW_INT_COUNT = 6;
    /** 每行字节数（6 × 4，小端） */
    public static final int ROW_SIZE_BYTES = ROW_INT_COUNT * Integer.BYTES;
    /** 行存文件名 */
    public static final String ROW_STORE_FILE_NAME = "docmeta.bin";
    /** 行存描述文件名 */
    public static final String ROW_STORE_META_FILE_NAME = "meta.json";
    /** 行存结构描述（与原始打包格式保持一致） */
    public static final String ROW_STORE_STRUCT = "<6i";

    // ==================== 日期键编码 ====================
    /** 日期键纪元：1960-01-01 UTC */
    public static final LocalDate DATE_KEY_EPOCH = LocalDate.of(1960, 1, 1);
    /** 一天的秒数，日期键按此对齐 */
    public static final int DAY_SECONDS = 86_400;

    // ==================== 索引名称 ====================
    /** 按地点（所属机构）索引 */
    public static final String INDEX_LOCATION = "loc_id";
    /** 按公告类型索引 */
    public static final String INDEX_TYPE = "type_id";
    /** 按自然日索引 */
    public static final String INDEX_DATE = "date_int";
    /** 按公司编码索引（离线构建） */
    public static final String INDEX_COMPANY = "comp_code";

    // ==================== 索引布局 ====================
    /** 索引文件扩展名 */
    public static final String INDEX_FILE_EXTENSION = "json";
    /** 两级分片目录掩码，目录名为 key & 0xFF 的两位十六进制 */
    public static final int SHARD_FANOUT_MASK = 0xFF;
    /** 两级分片子目录数量 */
    public static final int SHARD_FANOUT_DIRS = SHARD_FANOUT_MASK + 1;
    /** 原子写入临时文件后缀 */
    public static final String TEMP_FILE_SUFFIX = ".tmp";
    /** 分片目录统计文件名 */
    public static final String SHARD_META_FILE_NAME = "_meta.json";
    /** 整体索引缓存上限（按索引名计） */
    public static final int MONOLITHIC_CACHE_SIZE = 8;

    // ==================== 查询参数 ====================
    /** 日期区间物化的选择性乘数 */
    public static final int SELECTIVITY_MULTIPLIER = 4;
    /** 默认返回条数 */
    public static final int DEFAULT_SEARCH_LIMIT = 40;
    /** 返回条数下限 */
    public static final int MIN_SEARCH_LIMIT = 1;
    /** 返回条数上限 */
    public static final int MAX_SEARCH_LIMIT = 200;

    // ==================== 构建参数 ====================
    /** 扫描进度日志间隔（行） */
    public static final int DEFAULT_SCAN_PROGRESS_ROWS = 250_000;
    /** 写入进度日志间隔（文件） */
    public static final int DEFAULT_WRITE_PROGRESS_FILES = 5_000;
    /** 被中断时的进程退出码 */
    public static final int EXIT_CODE_INTERRUPTED = 130;
}
