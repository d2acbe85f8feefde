package com.gazetteindex.storage;

import java.util.Arrays;

/**
 * 倒排列表，包含共享同一索引键的全部行号。
 *
 * @param rowIds 严格递增的行号数组
 */
public record PostingList(int[] rowIds) {
    /** 空倒排列表 */
    public static final PostingList EMPTY = new PostingList(new int[0]);

    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (rowIds == null) {
            throw new IllegalArgumentException("rowIds不能为null");
        }
        for (int index = 0; index < rowIds.length; index++) {
            if (rowIds[index] < 0) {
                throw new IllegalArgumentException("rowId不能为负数，位置=" + index + ", value=" + rowIds[index]);
            }
            if (index > 0 && rowIds[index] <= rowIds[index - 1]) {
                throw new IllegalArgumentException("rowIds必须严格递增，位置=" + index + ", current=" + rowIds[index]);
            }
        }
        rowIds = Arrays.copyOf(rowIds, rowIds.length);
    }

    /**
     * 由若干行号创建倒排列表。
     */
    public static PostingList of(int... rowIds) {
        return new PostingList(rowIds);
    }

    /**
     * 返回倒排项数量。
     *
     * @return 倒排项数量
     */
    public int size() {
        return rowIds.length;
    }

    public boolean isEmpty() {
        return rowIds.length == 0;
    }

    /**
     * 获取指定位置的行号。
     *
     * @param index 倒排项下标
     * @return 行号
     */
    public int rowId(int index) {
        return rowIds[index];
    }

    @Override
    public int[] rowIds() {
        return Arrays.copyOf(rowIds, rowIds.length);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PostingList that && Arrays.equals(rowIds, that.rowIds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(rowIds);
    }

    @Override
    public String toString() {
        return "PostingList" + Arrays.toString(rowIds);
    }
}
