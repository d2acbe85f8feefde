package com.gazetteindex.runtime;

import com.gazetteindex.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 持有当前运行上下文，重新加载时整体替换，读者不会看到半更新的状态。
 */
public final class EngineContextHolder implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EngineContextHolder.class);

    private final AtomicReference<EngineContext> current;

    public EngineContextHolder(EngineContext initial) {
        if (initial == null) {
            throw new IllegalArgumentException("初始上下文不能为空");
        }
        this.current = new AtomicReference<>(initial);
    }

    /**
     * 当前上下文。调用方在一次请求内应只取一次并持有该引用。
     */
    public EngineContext current() {
        EngineContext context = current.get();
        if (context == null) {
            throw new IllegalStateException("EngineContextHolder 已关闭");
        }
        return context;
    }

    /**
     * 按新配置构造上下文并替换当前上下文；新上下文构造失败时保持原状。
     *
     * <p>被替换的上下文不在此处关闭：仍持有旧引用的请求可以继续读完，映射在旧上下文
     * 不可达后由 JVM 回收。
     *
     * @param config 新配置
     * @return 新上下文
     * @throws IOException 新上下文打开行存失败时抛出
     */
    public EngineContext reload(EngineConfig config) throws IOException {
        EngineContext replacement = EngineContext.open(config);
        current.set(replacement);
        logger.info("运行上下文已重新加载: rowStore={}, indexRoot={}, shardsRoot={}",
            config.getRowStorePath(), config.getIndexRoot(), config.getShardsRoot());
        return replacement;
    }

    @Override
    public void close() {
        EngineContext previous = current.getAndSet(null);
        if (previous != null) {
            previous.close();
        }
    }
}
