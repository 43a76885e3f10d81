package com.blockindex.config;

import java.util.Set;

/**
 * 全局常量定义
 *
 * 包含块/分片容量默认值、磁盘目录布局和标点过滤集合
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 构建参数 ====================
    /** 单个内存块最多缓冲的 (termId, docId) 记录数 */
    public static final int DEFAULT_BLOCK_CAPACITY = 10_000;
    /** 块内单个分片的词条上限 */
    public static final int DEFAULT_BLOCK_SHARD_CAPACITY = 1_000;
    /** 最终索引单个分片的词条上限 */
    public static final int DEFAULT_INDEX_SHARD_CAPACITY = 10_000;

    // ==================== 磁盘布局 ====================
    /** 块目录的父目录名 */
    public static final String BLOCKS_DIR_NAME = "blocks";
    /** 最终索引目录名 */
    public static final String INDEX_DIR_NAME = "index";
    /** 块目录前缀，完整名称为 block-&lt;index&gt; */
    public static final String BLOCK_DIR_PREFIX = "block-";
    /** 分片文件前缀，完整名称为 shard-&lt;i&gt; */
    public static final String SHARD_FILE_PREFIX = "shard-";
    /** 索引目录内的标记文件，表明目录由本工具发布，可以被重建替换 */
    public static final String INDEX_MARKER_FILE = ".block-index";
    /** 合并阶段暂存目录前缀，发布成功后被重命名为 index */
    public static final String STAGING_DIR_PREFIX = "index.staging-";

    // ==================== 分词参数 ====================
    /** 不参与建索引的标点集合 */
    public static final Set<String> PUNCTUATION = Set.of(".", "!", "?", ":", ";", ",", "(", ")", "—", "·");
}
