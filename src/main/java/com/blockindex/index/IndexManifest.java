package com.blockindex.index;

import java.nio.file.Path;

/**
 * 合并完成并发布后的最终索引描述。
 *
 * @param indexDir 索引目录
 * @param shardCount 分片数量
 * @param termCount 词条数量
 * @param postingCount 去重后的倒排项总数
 */
public record IndexManifest(Path indexDir, int shardCount, int termCount, long postingCount) {
}
