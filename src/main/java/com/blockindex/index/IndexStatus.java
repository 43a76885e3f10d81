package com.blockindex.index;

import java.nio.file.Path;

/**
 * 一次构建的统计信息。
 */
public record IndexStatus(
        Path indexDir,
        int docCount,
        int termCount,
        int blockCount,
        int shardCount,
        long postingCount,
        long indexSizeBytes
) {
}
