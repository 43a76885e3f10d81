package com.blockindex.storage;

import com.blockindex.config.Constants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 分片文件布局工具：块目录 block-&lt;b&gt;、分片文件 shard-&lt;i&gt; 的命名与目录维护。
 */
public final class ShardFiles {
    private static final Pattern SHARD_FILE_NAME = Pattern.compile(Pattern.quote(Constants.SHARD_FILE_PREFIX) + "\\d+");
    private static final Pattern BLOCK_DIR_NAME = Pattern.compile(Pattern.quote(Constants.BLOCK_DIR_PREFIX) + "\\d+");

    private ShardFiles() {
    }

    /**
     * 块目录路径。
     *
     * @param blocksDir 块根目录
     * @param blockIndex 块序号
     * @return blocksDir/block-&lt;blockIndex&gt;
     */
    public static Path blockDir(Path blocksDir, int blockIndex) {
        if (blockIndex < 0) {
            throw new IllegalArgumentException("blockIndex不能为负数: " + blockIndex);
        }
        return blocksDir.resolve(Constants.BLOCK_DIR_PREFIX + blockIndex);
    }

    /**
     * 目录内第 shardIndex 个分片文件路径。
     *
     * @param dir 块目录或索引目录
     * @param shardIndex 分片序号
     * @return dir/shard-&lt;shardIndex&gt;
     */
    public static Path shardFile(Path dir, int shardIndex) {
        if (shardIndex < 0) {
            throw new IllegalArgumentException("shardIndex不能为负数: " + shardIndex);
        }
        return dir.resolve(Constants.SHARD_FILE_PREFIX + shardIndex);
    }

    /**
     * 统计目录中从 shard-0 开始连续存在的分片数量。
     *
     * @param dir 块目录或索引目录
     * @return 分片数量，目录不存在时为 0
     */
    public static int countShards(Path dir) {
        int shardCount = 0;
        while (Files.isRegularFile(shardFile(dir, shardCount))) {
            shardCount++;
        }
        return shardCount;
    }

    /**
     * 确认索引目录可以被替换：只含本工具的标记文件与 shard-&lt;i&gt; 文件。目录不存在时直接通过。
     *
     * @throws IOException 目录含其他内容或不是目录时抛出
     */
    public static void requireManagedIndexDir(Path indexDir) throws IOException {
        if (!Files.exists(indexDir)) {
            return;
        }
        if (!Files.isDirectory(indexDir)) {
            throw new IOException("索引路径已存在且不是目录，拒绝覆盖: " + indexDir);
        }
        try (Stream<Path> entries = Files.list(indexDir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();
                boolean managed = Files.isRegularFile(entry)
                    && (name.equals(Constants.INDEX_MARKER_FILE) || SHARD_FILE_NAME.matcher(name).matches());
                if (!managed) {
                    throw new IOException("索引目录包含非本工具生成的内容，拒绝覆盖: " + entry);
                }
            }
        }
    }

    /**
     * 确认块根目录可以被清空：只含 block-&lt;b&gt; 子目录，且子目录内只有 shard-&lt;i&gt; 文件。目录不存在时直接通过。
     *
     * @throws IOException 目录含其他内容或不是目录时抛出
     */
    public static void requireManagedBlocksDir(Path blocksDir) throws IOException {
        if (!Files.exists(blocksDir)) {
            return;
        }
        if (!Files.isDirectory(blocksDir)) {
            throw new IOException("块路径已存在且不是目录，拒绝清理: " + blocksDir);
        }
        try (Stream<Path> blockDirs = Files.list(blocksDir)) {
            for (Path blockDir : (Iterable<Path>) blockDirs::iterator) {
                if (!Files.isDirectory(blockDir)
                        || !BLOCK_DIR_NAME.matcher(blockDir.getFileName().toString()).matches()) {
                    throw new IOException("块目录包含非本工具生成的内容，拒绝清理: " + blockDir);
                }
                try (Stream<Path> shards = Files.list(blockDir)) {
                    for (Path shard : (Iterable<Path>) shards::iterator) {
                        if (!Files.isRegularFile(shard)
                                || !SHARD_FILE_NAME.matcher(shard.getFileName().toString()).matches()) {
                            throw new IOException("块目录包含非本工具生成的内容，拒绝清理: " + shard);
                        }
                    }
                }
            }
        }
    }

    /**
     * 递归删除目录，目录不存在时直接返回。
     *
     * @param dir 目标目录
     * @throws IOException 删除失败时抛出
     */
    public static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
