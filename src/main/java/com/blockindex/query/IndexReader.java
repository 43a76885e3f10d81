package com.blockindex.query;

import com.blockindex.storage.IndexEntry;
import com.blockindex.storage.Shard;
import com.blockindex.storage.ShardCodec;
import com.blockindex.storage.ShardFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 最终索引读取器，按分片顺序扫描查找词条。
 *
 * 不持有可变状态，可被多个查询线程并发使用；前提是索引目录在读取期间不被重写。
 */
public final class IndexReader {
    private static final int[] NO_DOCS = new int[0];

    private final Path indexDir;
    private final int shardCount;

    /**
     * 打开索引目录并统计分片数量。
     *
     * @param indexDir 最终索引目录
     * @throws IOException 目录不存在时抛出
     */
    public IndexReader(Path indexDir) throws IOException {
        if (indexDir == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        if (!Files.isDirectory(indexDir)) {
            throw new IOException("索引目录不存在: " + indexDir);
        }
        this.indexDir = indexDir;
        this.shardCount = ShardFiles.countShards(indexDir);
    }

    public Path indexDir() {
        return indexDir;
    }

    public int shardCount() {
        return shardCount;
    }

    /**
     * 读取第 shardIndex 个分片。
     *
     * @throws IOException 读取失败或分片损坏时抛出
     */
    public Shard readShard(int shardIndex) throws IOException {
        if (shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException("分片序号越界: " + shardIndex + ", shardCount=" + shardCount);
        }
        return ShardCodec.read(ShardFiles.shardFile(indexDir, shardIndex));
    }

    /**
     * 从第一个分片开始扫描，返回首个匹配词条的文档 ID；未命中返回空数组。
     *
     * 分片全局按 termId 有序，遇到更大的 termId 即可停止扫描。
     *
     * @param termId 词项 ID
     * @return 升序文档 ID
     * @throws IOException 读取失败或分片损坏时抛出
     */
    public int[] lookup(int termId) throws IOException {
        if (termId < 0) {
            return NO_DOCS;
        }
        for (int shardIndex = 0; shardIndex < shardCount; shardIndex++) {
            Shard shard = readShard(shardIndex);
            if (shard.isEmpty() || shard.lastTermId() < termId) {
                continue;
            }
            for (IndexEntry entry : shard.entries()) {
                if (entry.termId() == termId) {
                    return entry.docIds();
                }
                if (entry.termId() > termId) {
                    return NO_DOCS;
                }
            }
        }
        return NO_DOCS;
    }
}
