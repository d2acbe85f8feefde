package com.gazetteindex.storage;

/**
 * 按行号读取记录。
 */
public interface RowSource {

    /**
     * 记录总数。
     */
    int rowCount();

    /**
     * 读取整行记录。
     *
     * @param rowId 行号
     * @return 行记录
     * @throws RowIdOutOfRangeException 行号越界时抛出
     */
    RowRecord get(long rowId);
}
