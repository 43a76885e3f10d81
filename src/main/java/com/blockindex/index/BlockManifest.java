package com.blockindex.index;

import java.nio.file.Path;

/**
 * 已落盘块的描述，合并阶段据此得知每个块需要读取的分片数量。
 *
 * @param blockIndex 块序号
 * @param dir 块目录
 * @param shardCount 分片文件数量
 * @param recordCount 块内 (termId, docId) 记录数
 */
public record BlockManifest(int blockIndex, Path dir, int shardCount, int recordCount) {
    public BlockManifest {
        if (blockIndex < 0) {
            throw new IllegalArgumentException("blockIndex不能为负数: " + blockIndex);
        }
        if (dir == null) {
            throw new IllegalArgumentException("块目录不能为null");
        }
        if (shardCount < 0 || recordCount < 0) {
            throw new IllegalArgumentException("计数不能为负数: shardCount=" + shardCount + ", recordCount=" + recordCount);
        }
    }
}
