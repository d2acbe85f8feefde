package com.gazetteindex.runtime;

import com.gazetteindex.config.EngineConfig;
import com.gazetteindex.index.IndexStore;
import com.gazetteindex.query.QueryPlanner;
import com.gazetteindex.query.SearchFilters;
import com.gazetteindex.query.SearchResult;
import com.gazetteindex.storage.PostingList;
import com.gazetteindex.storage.RowRecord;

import java.io.IOException;

/**
 * 一次构造、只读共享的运行上下文：配置、行存、索引读取与查询规划。
 *
 * <p>上下文创建后不再修改；需要切换数据时由 {@link EngineContextHolder} 整体替换。
 */
public final class EngineContext implements AutoCloseable {
    private final EngineConfig config;
    private final LazyRowStore rowStore;
    private final IndexStore indexStore;
    private final QueryPlanner queryPlanner;

    private EngineContext(EngineConfig config, LazyRowStore rowStore, IndexStore indexStore) {
        this.config = config;
        this.rowStore = rowStore;
        this.indexStore = indexStore;
        this.queryPlanner = new QueryPlanner(indexStore, rowStore, config);
    }

    /**
     * 按配置创建上下文；eagerOpen 为真时立即打开行存，失败即为启动期配置错误。
     *
     * @param config 引擎配置
     * @return 上下文
     * @throws IOException 立即打开行存失败时抛出
     */
    public static EngineContext open(EngineConfig config) throws IOException {
        LazyRowStore rowStore = new LazyRowStore(config.getRowStorePath());
        if (config.isEagerOpen()) {
            rowStore.initialize();
        }
        return new EngineContext(config, rowStore, new IndexStore(config));
    }

    public EngineConfig getConfig() {
        return config;
    }

    public IndexStore getIndexStore() {
        return indexStore;
    }

    public QueryPlanner getQueryPlanner() {
        return queryPlanner;
    }

    public LazyRowStore getRowStore() {
        return rowStore;
    }

    public SearchResult search(SearchFilters filters) throws IOException {
        return queryPlanner.search(filters);
    }

    public RowRecord getRow(long rowId) {
        return rowStore.get(rowId);
    }

    public PostingList postings(String indexName, int key) throws IOException {
        return indexStore.postings(indexName, key);
    }

    /**
     * 返回状态快照，不触发行存打开。
     */
    public EngineStatus status() {
        LazyRowStore.State state = rowStore.getState();
        return new EngineStatus(
            state == LazyRowStore.State.READY,
            state,
            rowStore.rowCountIfReady(),
            config.getDataRoot(),
            config.getRowStorePath(),
            config.getIndexRoot(),
            config.getShardsRoot()
        );
    }

    @Override
    public void close() {
        rowStore.close();
    }
}
