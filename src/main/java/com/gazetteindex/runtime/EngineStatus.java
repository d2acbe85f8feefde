package com.gazetteindex.runtime;

import java.nio.file.Path;

/**
 * 引擎运行状态快照。
 */
public record EngineStatus(
        boolean ok,
        LazyRowStore.State rowStoreState,
        int rows,
        Path dataRoot,
        Path rowStorePath,
        Path indexRoot,
        Path shardsRoot
) {
}
