package com.gazetteindex.storage;

import com.gazetteindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 行存写入器，按 24 字节小端格式顺序写入记录。
 *
 * <p>内容先写入同目录临时文件，调用 {@link #commit()} 后原子重命名为目标文件并生成
 * meta.json；未提交即关闭时丢弃临时文件，目标路径保持原状。
 */
public final class RowStoreWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RowStoreWriter.class);

    private final Path target;
    private final Path tempPath;
    private final OutputStream outputStream;
    private final ByteBuffer rowBuffer = ByteBuffer.allocate(Constants.ROW_SIZE_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    private int rowCount;
    private boolean closed;

    /**
     * 创建写入器。
     *
     * @param target 行存目标文件
     * @throws IOException 创建临时文件失败时抛出
     */
    public RowStoreWriter(Path target) throws IOException {
        if (target == null) {
            throw new IllegalArgumentException("行存文件不能为空");
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.target = target;
        this.tempPath = StorageFileUtil.tempPathFor(target);
        this.outputStream = new BufferedOutputStream(Files.newOutputStream(tempPath));
    }

    /**
     * 追加一行记录，行号即写入顺序。
     *
     * @param record 行记录
     * @return 该记录的行号
     * @throws IOException 写入失败时抛出
     */
    public int write(RowRecord record) throws IOException {
        ensureOpen();
        if (rowCount == Integer.MAX_VALUE) {
            throw new IOException("行存行数超过上限");
        }
        rowBuffer.clear();
        rowBuffer.putInt(record.dateKey())
            .putInt(record.locationCode())
            .putInt(record.typeCode())
            .putInt(record.companyCode())
            .putInt(record.adId())
            .putInt(record.adLinkCode());
        outputStream.write(rowBuffer.array(), 0, Constants.ROW_SIZE_BYTES);
        return rowCount++;
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * 提交写入：刷新数据、原子替换目标文件并写出 meta.json。
     *
     * @throws IOException 提交失败时抛出
     */
    public void commit() throws IOException {
        ensureOpen();
        closed = true;
        try {
            outputStream.close();
            Files.move(tempPath, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException exception) {
            Files.deleteIfExists(tempPath);
            throw new IOException("提交行存失败: " + target, exception);
        }
        RowStoreMeta.forRows(rowCount)
            .writeTo(target.resolveSibling(Constants.ROW_STORE_META_FILE_NAME).toFile());
        logger.info("行存写入完成: {} ({} 行)", target, rowCount);
    }

    /**
     * 关闭写入器；未提交时丢弃临时文件。
     *
     * @throws IOException 清理失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            outputStream.close();
        } finally {
            Files.deleteIfExists(tempPath);
            logger.warn("行存写入未提交，已丢弃临时文件: {}", tempPath);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("RowStoreWriter 已关闭");
        }
    }
}
