package com.blockindex.config;

import com.blockindex.algebra.PostingRepresentation;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * 索引运行时配置
 *
 * 支持从CLI参数或 properties 文件注入，覆盖Constants默认值
 */
public class IndexConfig {
    public static final String KEY_WORK_DIR = "work.dir";
    public static final String KEY_BLOCK_CAPACITY = "block.capacity";
    public static final String KEY_BLOCK_SHARD_CAPACITY = "block.shard.capacity";
    public static final String KEY_INDEX_SHARD_CAPACITY = "index.shard.capacity";
    public static final String KEY_REPRESENTATION = "posting.representation";
    public static final String KEY_KEEP_BLOCKS = "blocks.keep";

    private Path workDir = Paths.get(".");
    private int blockCapacity = Constants.DEFAULT_BLOCK_CAPACITY;
    private int blockShardCapacity = Constants.DEFAULT_BLOCK_SHARD_CAPACITY;
    private int indexShardCapacity = Constants.DEFAULT_INDEX_SHARD_CAPACITY;
    private PostingRepresentation representation = PostingRepresentation.SORTED_LIST;
    private Set<String> punctuation = Constants.PUNCTUATION;
    private boolean keepBlocks;

    public Path getWorkDir() {
        return workDir;
    }

    public void setWorkDir(Path workDir) {
        if (workDir == null) {
            throw new IllegalArgumentException("workDir不能为null");
        }
        this.workDir = workDir;
    }

    /**
     * 块目录的父目录：&lt;workDir&gt;/blocks
     */
    public Path getBlocksDir() {
        return workDir.resolve(Constants.BLOCKS_DIR_NAME);
    }

    /**
     * 最终索引目录：&lt;workDir&gt;/index
     */
    public Path getIndexDir() {
        return workDir.resolve(Constants.INDEX_DIR_NAME);
    }

    public int getBlockCapacity() {
        return blockCapacity;
    }

    public void setBlockCapacity(int blockCapacity) {
        this.blockCapacity = requirePositive(KEY_BLOCK_CAPACITY, blockCapacity);
    }

    public int getBlockShardCapacity() {
        return blockShardCapacity;
    }

    public void setBlockShardCapacity(int blockShardCapacity) {
        this.blockShardCapacity = requirePositive(KEY_BLOCK_SHARD_CAPACITY, blockShardCapacity);
    }

    public int getIndexShardCapacity() {
        return indexShardCapacity;
    }

    public void setIndexShardCapacity(int indexShardCapacity) {
        this.indexShardCapacity = requirePositive(KEY_INDEX_SHARD_CAPACITY, indexShardCapacity);
    }

    public PostingRepresentation getRepresentation() {
        return representation;
    }

    public void setRepresentation(PostingRepresentation representation) {
        if (representation == null) {
            throw new IllegalArgumentException("representation不能为null");
        }
        this.representation = representation;
    }

    public Set<String> getPunctuation() {
        return punctuation;
    }

    public void setPunctuation(Set<String> punctuation) {
        if (punctuation == null) {
            throw new IllegalArgumentException("punctuation不能为null");
        }
        this.punctuation = Set.copyOf(punctuation);
    }

    public boolean isKeepBlocks() {
        return keepBlocks;
    }

    public void setKeepBlocks(boolean keepBlocks) {
        this.keepBlocks = keepBlocks;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }

    /**
     * 从 properties 覆盖默认值，未出现的键保持默认。
     *
     * @param properties 配置项
     * @return 新配置实例
     * @throws IllegalArgumentException 配置值无法解析或非法时抛出
     */
    public static IndexConfig fromProperties(Properties properties) {
        IndexConfig config = defaults();
        String workDir = properties.getProperty(KEY_WORK_DIR);
        if (workDir != null && !workDir.isBlank()) {
            config.setWorkDir(Paths.get(workDir.trim()));
        }
        String blockCapacity = properties.getProperty(KEY_BLOCK_CAPACITY);
        if (blockCapacity != null) {
            config.setBlockCapacity(parseInt(KEY_BLOCK_CAPACITY, blockCapacity));
        }
        String blockShardCapacity = properties.getProperty(KEY_BLOCK_SHARD_CAPACITY);
        if (blockShardCapacity != null) {
            config.setBlockShardCapacity(parseInt(KEY_BLOCK_SHARD_CAPACITY, blockShardCapacity));
        }
        String indexShardCapacity = properties.getProperty(KEY_INDEX_SHARD_CAPACITY);
        if (indexShardCapacity != null) {
            config.setIndexShardCapacity(parseInt(KEY_INDEX_SHARD_CAPACITY, indexShardCapacity));
        }
        String representation = properties.getProperty(KEY_REPRESENTATION);
        if (representation != null) {
            try {
                config.setRepresentation(PostingRepresentation.valueOf(representation.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException exception) {
                throw new IllegalArgumentException("未知的倒排表示: " + representation, exception);
            }
        }
        String keepBlocks = properties.getProperty(KEY_KEEP_BLOCKS);
        if (keepBlocks != null) {
            config.setKeepBlocks(Boolean.parseBoolean(keepBlocks.trim()));
        }
        return config;
    }

    /**
     * 读取 UTF-8 编码的 properties 文件。
     *
     * @param propertiesFile 配置文件路径
     * @return 新配置实例
     * @throws IOException 文件读取失败时抛出
     */
    public static IndexConfig load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    private static int parseInt(String key, String rawValue) {
        try {
            return Integer.parseInt(rawValue.trim());
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("配置项" + key + "不是整数: " + rawValue, exception);
        }
    }

    private static int requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + "必须为正数: " + value);
        }
        return value;
    }
}
