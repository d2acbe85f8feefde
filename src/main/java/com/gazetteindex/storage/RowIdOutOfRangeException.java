package com.gazetteindex.storage;

/**
 * 行号超出行存范围。属于数据一致性错误，调用方不应将其视为空结果。
 */
public class RowIdOutOfRangeException extends RuntimeException {
    private final long rowId;
    private final int rowCount;

    public RowIdOutOfRangeException(long rowId, int rowCount) {
        super("行号超出范围: rowId=" + rowId + ", rowCount=" + rowCount);
        this.rowId = rowId;
        this.rowCount = rowCount;
    }

    public long getRowId() {
        return rowId;
    }

    public int getRowCount() {
        return rowCount;
    }
}
