package com.gazetteindex.storage;

import com.gazetteindex.config.Constants;

import java.util.Locale;

/**
 * 行记录字段，按磁盘上的固定顺序排列。
 */
public enum RowField {
    DATE_KEY(Constants.INDEX_DATE),
    LOCATION(Constants.INDEX_LOCATION),
    TYPE(Constants.INDEX_TYPE),
    COMPANY(Constants.INDEX_COMPANY),
    AD_ID("ad_id"),
    AD_LINK("ad_link_code");

    private final String indexName;

    RowField(String indexName) {
        this.indexName = indexName;
    }

    /**
     * 以该字段分桶时使用的默认索引名。
     */
    public String indexName() {
        return indexName;
    }

    /**
     * 字段在行内的字节偏移。
     */
    public int byteOffset() {
        return ordinal() * Integer.BYTES;
    }

    /**
     * 按枚举名或索引名解析字段，大小写不敏感。
     *
     * @param name 字段名，例如 COMPANY 或 comp_code
     * @return 对应字段
     */
    public static RowField fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("字段名不能为空");
        }
        String normalized = name.trim();
        for (RowField field : values()) {
            if (field.name().equalsIgnoreCase(normalized) || field.indexName.equalsIgnoreCase(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("未知字段: " + name.toLowerCase(Locale.ROOT));
    }
}
