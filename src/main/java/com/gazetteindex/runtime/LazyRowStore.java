package com.gazetteindex.runtime;

import com.gazetteindex.storage.RowRecord;
import com.gazetteindex.storage.RowSource;
import com.gazetteindex.storage.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 延迟打开的行存，状态机为 UNINITIALIZED → READY → CLOSED。
 *
 * <p>处于 UNINITIALIZED 时的读取会尝试打开文件；文件尚不存在则抛出
 * {@link StoreNotReadyException} 并保持原状态，文件存在但格式非法属于配置错误，
 * 以 {@link IllegalStateException} 抛出。READY 之后的读取不加锁。
 */
public final class LazyRowStore implements RowSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LazyRowStore.class);

    public enum State {
        UNINITIALIZED,
        READY,
        CLOSED
    }

    private final Path path;
    private volatile State state = State.UNINITIALIZED;
    private volatile RowStore rowStore;

    public LazyRowStore(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("行存路径不能为空");
        }
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public State getState() {
        return state;
    }

    /**
     * 立即打开行存，用于启动期校验。
     *
     * @throws IOException 文件缺失或格式非法时抛出
     */
    public synchronized void initialize() throws IOException {
        if (state == State.CLOSED) {
            throw new IllegalStateException("LazyRowStore 已关闭");
        }
        if (state == State.READY) {
            return;
        }
        rowStore = RowStore.open(path);
        state = State.READY;
    }

    /**
     * 返回已打开的行存，必要时触发打开。
     *
     * @return 行存
     * @throws StoreNotReadyException 行存文件尚不存在时抛出
     */
    public RowStore acquire() {
        RowStore current = rowStore;
        if (current != null && state == State.READY) {
            return current;
        }
        return openOnDemand();
    }

    @Override
    public int rowCount() {
        return acquire().rowCount();
    }

    @Override
    public RowRecord get(long rowId) {
        return acquire().get(rowId);
    }

    /**
     * 当前行数；未就绪时返回 0，不触发打开。
     */
    public int rowCountIfReady() {
        RowStore current = rowStore;
        return state == State.READY && current != null ? current.rowCount() : 0;
    }

    @Override
    public synchronized void close() {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        if (rowStore != null) {
            rowStore.close();
            rowStore = null;
        }
    }

    private synchronized RowStore openOnDemand() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("LazyRowStore 已关闭");
        }
        if (state == State.READY) {
            return rowStore;
        }
        if (!Files.exists(path)) {
            throw new StoreNotReadyException("行存尚未加载: " + path);
        }
        try {
            rowStore = RowStore.open(path);
        } catch (IOException exception) {
            throw new IllegalStateException("行存配置错误: " + path, exception);
        }
        state = State.READY;
        logger.info("行存延迟加载完成: {}", path);
        return rowStore;
    }
}
