package com.blockindex.index;

import com.blockindex.storage.IndexEntry;
import com.blockindex.storage.Shard;
import com.blockindex.storage.ShardCodec;
import com.blockindex.storage.ShardFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 块构建器：缓冲 (termId, docId) 记录，满额后排序、分组、切分为分片并写入块目录。
 *
 * 非线程安全；flush 为阻塞操作。
 */
public final class BlockBuilder {
    private static final Logger logger = LoggerFactory.getLogger(BlockBuilder.class);

    private final Path blocksDir;
    private final int blockCapacity;
    private final int shardCapacity;
    private final int[] bufferedTermIds;
    private final int[] bufferedDocIds;
    private final List<BlockManifest> blocks = new ArrayList<>();
    private int bufferedCount;
    private boolean finished;

    /**
     * @param blocksDir 块根目录，块写入 blocksDir/block-&lt;b&gt;
     * @param blockCapacity 单块最多缓冲的记录数
     * @param shardCapacity 单分片最多包含的词条数
     */
    public BlockBuilder(Path blocksDir, int blockCapacity, int shardCapacity) {
        if (blocksDir == null) {
            throw new IllegalArgumentException("块根目录不能为空");
        }
        if (blockCapacity <= 0 || shardCapacity <= 0) {
            throw new IllegalArgumentException("容量必须为正数: blockCapacity=" + blockCapacity + ", shardCapacity=" + shardCapacity);
        }
        this.blocksDir = blocksDir;
        this.blockCapacity = blockCapacity;
        this.shardCapacity = shardCapacity;
        this.bufferedTermIds = new int[blockCapacity];
        this.bufferedDocIds = new int[blockCapacity];
    }

    /**
     * 追加一条记录，缓冲区满时立即落盘。
     *
     * @param termId 词项 ID
     * @param docId 文档 ID
     * @throws IOException 落盘失败时抛出
     */
    public void add(int termId, int docId) throws IOException {
        ensureOpen();
        if (termId < 0 || docId < 0) {
            throw new IllegalArgumentException("termId与docId不能为负数: termId=" + termId + ", docId=" + docId);
        }
        bufferedTermIds[bufferedCount] = termId;
        bufferedDocIds[bufferedCount] = docId;
        bufferedCount++;
        if (bufferedCount == blockCapacity) {
            flush();
        }
    }

    /**
     * 落盘剩余记录并返回全部块描述，之后不可再追加。
     *
     * @return 按块序号排列的块描述
     * @throws IOException 落盘失败时抛出
     */
    public List<BlockManifest> finish() throws IOException {
        ensureOpen();
        flush();
        finished = true;
        logger.info("块构建完成: blocks={}", blocks.size());
        return List.copyOf(blocks);
    }

    /**
     * 当前缓冲区中尚未落盘的记录数。
     */
    public int bufferedCount() {
        return bufferedCount;
    }

    /**
     * 已落盘的块数量。
     */
    public int blockCount() {
        return blocks.size();
    }

    /**
     * 将缓冲区写为一个新块；空缓冲区不产生块。
     */
    private void flush() throws IOException {
        if (bufferedCount == 0) {
            return;
        }
        int blockIndex = blocks.size();
        List<Shard> shards = buildShards();

        Path blockDir = ShardFiles.blockDir(blocksDir, blockIndex);
        Files.createDirectories(blockDir);
        for (int shardIndex = 0; shardIndex < shards.size(); shardIndex++) {
            ShardCodec.write(shards.get(shardIndex), ShardFiles.shardFile(blockDir, shardIndex));
        }

        blocks.add(new BlockManifest(blockIndex, blockDir, shards.size(), bufferedCount));
        logger.debug("块已落盘: block={}, records={}, shards={}", blockIndex, bufferedCount, shards.size());
        bufferedCount = 0;
    }

    /**
     * 按 termId 稳定排序缓冲区，把相同 termId 的连续记录合并为一个词条，再按容量切分分片。
     */
    private List<Shard> buildShards() {
        // 高 32 位为 termId，低 32 位为到达序号：排序键唯一，相同词项保持到达顺序
        long[] sortKeys = new long[bufferedCount];
        for (int index = 0; index < bufferedCount; index++) {
            sortKeys[index] = ((long) bufferedTermIds[index] << 32) | index;
        }
        Arrays.sort(sortKeys);

        List<Shard> shards = new ArrayList<>();
        List<IndexEntry> currentEntries = new ArrayList<>();
        int[] runDocIds = new int[bufferedCount];
        int runLength = 0;
        int currentTermId = -1;

        for (long sortKey : sortKeys) {
            int termId = (int) (sortKey >>> 32);
            int docId = bufferedDocIds[(int) sortKey];
            if (termId != currentTermId) {
                if (currentTermId >= 0) {
                    appendEntry(shards, currentEntries, new IndexEntry(currentTermId, Arrays.copyOf(runDocIds, runLength)));
                }
                currentTermId = termId;
                runLength = 0;
            }
            // 同一文档的记录连续到达，相邻重复直接折叠
            if (runLength == 0 || runDocIds[runLength - 1] != docId) {
                runDocIds[runLength++] = docId;
            }
        }
        appendEntry(shards, currentEntries, new IndexEntry(currentTermId, Arrays.copyOf(runDocIds, runLength)));
        if (!currentEntries.isEmpty()) {
            shards.add(new Shard(currentEntries));
        }
        return shards;
    }

    private void appendEntry(List<Shard> shards, List<IndexEntry> currentEntries, IndexEntry entry) {
        if (currentEntries.size() == shardCapacity) {
            shards.add(new Shard(currentEntries));
            currentEntries.clear();
        }
        currentEntries.add(entry);
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("BlockBuilder 已完成");
        }
    }
}
