package com.blockindex.index;

import com.blockindex.config.Constants;
import com.blockindex.storage.CorruptShardException;
import com.blockindex.storage.IndexEntry;
import com.blockindex.storage.Shard;
import com.blockindex.storage.ShardCodec;
import com.blockindex.storage.ShardFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 块合并器：对所有块的分片序列做 k 路归并，去重文档 ID 后重新切分为最终索引分片。
 *
 * 输出先写入暂存目录，全部分片写完后才替换 index 目录；任一步失败时旧索引保持不变。
 * 每个块同一时刻只驻留一个解码后的分片。
 */
public final class BlockMerger {
    private static final Logger logger = LoggerFactory.getLogger(BlockMerger.class);

    private final Path indexDir;
    private final int indexShardCapacity;

    /**
     * @param indexDir 最终索引目录
     * @param indexShardCapacity 最终索引单分片词条上限
     */
    public BlockMerger(Path indexDir, int indexShardCapacity) {
        if (indexDir == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        if (indexShardCapacity <= 0) {
            throw new IllegalArgumentException("indexShardCapacity必须为正数: " + indexShardCapacity);
        }
        this.indexDir = indexDir.toAbsolutePath().normalize();
        this.indexShardCapacity = indexShardCapacity;
    }

    /**
     * 合并全部块并发布最终索引。
     *
     * @param blocks 块描述列表
     * @return 最终索引描述
     * @throws CorruptShardException 块分片损坏或块内分片无序时抛出
     * @throws IOException 读写失败，或已有 index 目录含非本工具生成的内容时抛出
     */
    public IndexManifest merge(List<BlockManifest> blocks) throws IOException {
        if (blocks == null) {
            throw new IllegalArgumentException("块列表不能为null");
        }
        ShardFiles.requireManagedIndexDir(indexDir);
        Path stagingDir = indexDir.resolveSibling(Constants.STAGING_DIR_PREFIX + System.nanoTime());
        Files.createDirectories(stagingDir);
        try {
            MergeStats stats = mergeInto(stagingDir, blocks);
            Files.writeString(stagingDir.resolve(Constants.INDEX_MARKER_FILE),
                "block-index shards=" + stats.shardCount + "\n");
            publish(stagingDir);
            logger.info("合并完成: blocks={}, terms={}, shards={}, postings={}",
                blocks.size(), stats.termCount, stats.shardCount, stats.postingCount);
            return new IndexManifest(indexDir, stats.shardCount, stats.termCount, stats.postingCount);
        } catch (IOException | RuntimeException exception) {
            try {
                ShardFiles.deleteRecursively(stagingDir);
            } catch (IOException cleanupException) {
                exception.addSuppressed(cleanupException);
            }
            throw exception;
        }
    }

    /**
     * k 路归并主循环，输出写入 outputDir。
     */
    private MergeStats mergeInto(Path outputDir, List<BlockManifest> blocks) throws IOException {
        List<BlockCursor> cursors = new ArrayList<>(blocks.size());
        for (BlockManifest block : blocks) {
            cursors.add(new BlockCursor(block));
        }

        MergeStats stats = new MergeStats();
        List<IndexEntry> outputEntries = new ArrayList<>();
        List<int[]> matchedPostings = new ArrayList<>(cursors.size());

        while (true) {
            boolean found = false;
            int minTermId = Integer.MAX_VALUE;
            for (BlockCursor cursor : cursors) {
                if (!cursor.hasEntry()) {
                    continue;
                }
                int termId = cursor.currentEntry().termId();
                if (!found || termId < minTermId) {
                    minTermId = termId;
                    found = true;
                }
            }
            if (!found) {
                break;
            }

            // 同一 termId 的所有块在同一步消费，保证每个词项只输出一次
            matchedPostings.clear();
            for (BlockCursor cursor : cursors) {
                if (cursor.hasEntry() && cursor.currentEntry().termId() == minTermId) {
                    matchedPostings.add(cursor.currentEntry().docIds());
                    cursor.advance();
                }
            }
            int[] mergedDocIds = unionDistinct(matchedPostings);
            outputEntries.add(new IndexEntry(minTermId, mergedDocIds));
            stats.termCount++;
            stats.postingCount += mergedDocIds.length;

            if (outputEntries.size() == indexShardCapacity) {
                writeOutputShard(outputDir, stats, outputEntries);
            }
        }

        if (!outputEntries.isEmpty()) {
            writeOutputShard(outputDir, stats, outputEntries);
        }
        return stats;
    }

    private void writeOutputShard(Path outputDir, MergeStats stats, List<IndexEntry> outputEntries) throws IOException {
        ShardCodec.write(new Shard(outputEntries), ShardFiles.shardFile(outputDir, stats.shardCount));
        logger.debug("索引分片已写入: shard={}, entries={}", stats.shardCount, outputEntries.size());
        stats.shardCount++;
        outputEntries.clear();
    }

    /**
     * 用暂存目录替换 index 目录：旧索引先改名备份，新索引就位后再删除备份。
     */
    private void publish(Path stagingDir) throws IOException {
        Path backupDir = null;
        if (Files.exists(indexDir)) {
            backupDir = indexDir.resolveSibling(indexDir.getFileName() + ".old-" + System.nanoTime());
            move(indexDir, backupDir);
        }
        try {
            move(stagingDir, indexDir);
        } catch (IOException exception) {
            if (backupDir != null) {
                try {
                    move(backupDir, indexDir);
                } catch (IOException restoreException) {
                    exception.addSuppressed(restoreException);
                }
            }
            throw exception;
        }
        if (backupDir != null) {
            ShardFiles.deleteRecursively(backupDir);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            logger.warn("文件系统不支持原子改名，退化为普通移动: {} -> {}", source, target);
            Files.move(source, target);
        }
    }

    /**
     * 合并多个文档 ID 数组，输出升序且无重复。
     */
    static int[] unionDistinct(List<int[]> postings) {
        int totalLength = 0;
        for (int[] docIds : postings) {
            totalLength += docIds.length;
        }
        int[] merged = new int[totalLength];
        int offset = 0;
        for (int[] docIds : postings) {
            System.arraycopy(docIds, 0, merged, offset, docIds.length);
            offset += docIds.length;
        }
        Arrays.sort(merged);

        int distinctLength = 0;
        for (int index = 0; index < merged.length; index++) {
            if (distinctLength == 0 || merged[distinctLength - 1] != merged[index]) {
                merged[distinctLength++] = merged[index];
            }
        }
        return Arrays.copyOf(merged, distinctLength);
    }

    private static final class MergeStats {
        private int shardCount;
        private int termCount;
        private long postingCount;
    }

    /**
     * 单个块的读取游标：当前分片、分片内下一个未读词条、剩余分片与完成标记。
     */
    private static final class BlockCursor {
        private final BlockManifest block;
        private Shard currentShard;
        private int entryIndex;
        private int nextShardIndex;
        private int lastTermId = -1;
        private boolean finished;

        private BlockCursor(BlockManifest block) {
            this.block = block;
        }

        /**
         * 当前分片读完时加载下一个分片；块内再无分片则标记完成。
         */
        private boolean hasEntry() throws IOException {
            while (!finished && (currentShard == null || entryIndex >= currentShard.size())) {
                if (nextShardIndex >= block.shardCount()) {
                    finished = true;
                    currentShard = null;
                    break;
                }
                Path shardFile = ShardFiles.shardFile(block.dir(), nextShardIndex);
                Shard shard = ShardCodec.read(shardFile);
                if (!shard.isEmpty() && shard.firstTermId() <= lastTermId) {
                    throw new CorruptShardException("块内分片未按termId排序: file=" + shardFile
                        + ", firstTermId=" + shard.firstTermId() + ", previousTermId=" + lastTermId);
                }
                currentShard = shard;
                entryIndex = 0;
                nextShardIndex++;
            }
            return !finished;
        }

        private IndexEntry currentEntry() {
            return currentShard.entry(entryIndex);
        }

        private void advance() {
            lastTermId = currentEntry().termId();
            entryIndex++;
        }
    }
}
