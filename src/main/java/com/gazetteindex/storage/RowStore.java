package com.gazetteindex.storage;

import com.gazetteindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 定长行存的只读内存映射访问器。
 *
 * <p>文件由若干 24 字节记录顺序组成，无文件头，行数由文件长度推出。超过 2GB 的文件
 * 按整行数切分为多个映射块，因此单条记录不会跨块。所有读取均为绝对位置读取，
 * 不改变缓冲区状态，多线程并发读取无需加锁。
 */
public final class RowStore implements RowSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RowStore.class);

    /** 单个映射块的最大行数，保证块字节数不超过 int 上限 */
    static final int MAX_CHUNK_ROWS = Integer.MAX_VALUE / Constants.ROW_SIZE_BYTES;

    private final Path path;
    private final int rowCount;
    private final int chunkRows;
    private volatile MappedByteBuffer[] chunks;

    private RowStore(Path path, int rowCount, int chunkRows, MappedByteBuffer[] chunks) {
        this.path = path;
        this.rowCount = rowCount;
        this.chunkRows = chunkRows;
        this.chunks = chunks;
    }

    /**
     * 打开并映射行存文件。
     *
     * @param path 行存文件路径
     * @return 只读行存
     * @throws NoSuchFileException 文件不存在时抛出
     * @throws RowStoreFormatException 文件长度不是行宽整数倍时抛出
     * @throws IOException 映射失败时抛出
     */
    public static RowStore open(Path path) throws IOException {
        return open(path, MAX_CHUNK_ROWS);
    }

    static RowStore open(Path path, int chunkRows) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("行存路径不能为空");
        }
        if (chunkRows <= 0 || chunkRows > MAX_CHUNK_ROWS) {
            throw new IllegalArgumentException("映射块行数非法: " + chunkRows);
        }
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "行存文件不存在");
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            if (fileSize % Constants.ROW_SIZE_BYTES != 0) {
                throw new RowStoreFormatException("行存文件长度不是 " + Constants.ROW_SIZE_BYTES
                    + " 的整数倍: " + path + ", size=" + fileSize);
            }
            long totalRows = fileSize / Constants.ROW_SIZE_BYTES;
            if (totalRows > Integer.MAX_VALUE) {
                throw new RowStoreFormatException("行存行数超过上限: " + path + ", rows=" + totalRows);
            }
            int rows = (int) totalRows;
            int chunkCount = (int) ((totalRows + chunkRows - 1) / chunkRows);
            MappedByteBuffer[] mapped = new MappedByteBuffer[chunkCount];
            for (int chunkIndex = 0; chunkIndex < chunkCount; chunkIndex++) {
                long firstRow = (long) chunkIndex * chunkRows;
                long rowsInChunk = Math.min(chunkRows, totalRows - firstRow);
                MappedByteBuffer buffer = channel.map(FileChannel.MapMode.READ_ONLY,
                    firstRow * Constants.ROW_SIZE_BYTES, rowsInChunk * Constants.ROW_SIZE_BYTES);
                buffer.order(ByteOrder.LITTLE_ENDIAN);
                mapped[chunkIndex] = buffer;
            }
            logger.info("行存已映射: {} ({} 行, {} 个映射块)", path, rows, chunkCount);
            return new RowStore(path, rows, chunkRows, mapped);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public RowRecord get(long rowId) {
        MappedByteBuffer chunk = chunkFor(rowId);
        int base = offsetInChunk(rowId);
        return new RowRecord(
            chunk.getInt(base),
            chunk.getInt(base + Integer.BYTES),
            chunk.getInt(base + 2 * Integer.BYTES),
            chunk.getInt(base + 3 * Integer.BYTES),
            chunk.getInt(base + 4 * Integer.BYTES),
            chunk.getInt(base + 5 * Integer.BYTES)
        );
    }

    /**
     * 只读取单个字段，供全表扫描使用。
     *
     * @param rowId 行号
     * @param field 字段
     * @return 字段值
     */
    public int getField(long rowId, RowField field) {
        MappedByteBuffer chunk = chunkFor(rowId);
        return chunk.getInt(offsetInChunk(rowId) + field.byteOffset());
    }

    public boolean isClosed() {
        return chunks == null;
    }

    /**
     * 释放映射引用。映射内存由 JVM 在缓冲区不可达后回收。
     */
    @Override
    public void close() {
        if (chunks == null) {
            return;
        }
        chunks = null;
        logger.info("行存已关闭: {}", path);
    }

    private MappedByteBuffer chunkFor(long rowId) {
        MappedByteBuffer[] current = chunks;
        if (current == null) {
            throw new IllegalStateException("RowStore 已关闭");
        }
        if (rowId < 0 || rowId >= rowCount) {
            throw new RowIdOutOfRangeException(rowId, rowCount);
        }
        return current[(int) (rowId / chunkRows)];
    }

    private int offsetInChunk(long rowId) {
        return (int) (rowId % chunkRows) * Constants.ROW_SIZE_BYTES;
    }
}
