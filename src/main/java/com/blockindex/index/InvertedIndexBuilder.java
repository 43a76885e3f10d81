package com.blockindex.index;

import com.blockindex.config.IndexConfig;
import com.blockindex.dictionary.DictionaryManager;
import com.blockindex.storage.ShardFiles;
import com.blockindex.text.PunctuationFilter;
import com.blockindex.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 索引构建流水线：词典分配 ID → 块构建落盘 → 块合并发布。
 *
 * 消费 (docId, token) 流；单写线程使用。
 */
public final class InvertedIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

    private final IndexConfig config;
    private final DictionaryManager dictionary;
    private final PunctuationFilter punctuationFilter;
    private final BlockBuilder blockBuilder;
    private boolean finished;

    /**
     * 创建构建器，并清空上次构建遗留的块目录。
     *
     * @param config 构建配置
     * @throws IOException 块目录含非本工具生成的内容或清理失败时抛出
     */
    public InvertedIndexBuilder(IndexConfig config) throws IOException {
        this(config, new DictionaryManager());
    }

    /**
     * 使用外部提供的词典创建构建器。
     */
    public InvertedIndexBuilder(IndexConfig config, DictionaryManager dictionary) throws IOException {
        if (config == null || dictionary == null) {
            throw new IllegalArgumentException("config与dictionary不能为null");
        }
        this.config = config;
        this.dictionary = dictionary;
        this.punctuationFilter = new PunctuationFilter(config.getPunctuation());
        ShardFiles.requireManagedBlocksDir(config.getBlocksDir());
        ShardFiles.deleteRecursively(config.getBlocksDir());
        this.blockBuilder = new BlockBuilder(config.getBlocksDir(), config.getBlockCapacity(), config.getBlockShardCapacity());
    }

    /**
     * 登记文档并返回其 ID。
     */
    public int addDocument(Path path) {
        ensureOpen();
        return dictionary.assignDoc(path);
    }

    /**
     * 追加一个 token；标点或空白 token 被丢弃。
     *
     * @return token 是否进入索引
     * @throws IOException 块落盘失败时抛出
     */
    public boolean addToken(int docId, String token) throws IOException {
        ensureOpen();
        if (docId < 0 || docId >= dictionary.docCount()) {
            throw new IllegalArgumentException("未登记的docId: " + docId);
        }
        if (!punctuationFilter.isIndexable(token)) {
            return false;
        }
        blockBuilder.add(dictionary.assignTerm(token), docId);
        return true;
    }

    /**
     * 追加一个分词结果。
     */
    public boolean addToken(int docId, Token token) throws IOException {
        return token != null && addToken(docId, token.text());
    }

    /**
     * 追加一个文档的全部 token，返回进入索引的数量。
     */
    public int addTokens(int docId, List<Token> tokens) throws IOException {
        int indexedCount = 0;
        for (Token token : tokens) {
            if (addToken(docId, token)) {
                indexedCount++;
            }
        }
        return indexedCount;
    }

    /**
     * 落盘剩余记录、合并全部块并发布索引。
     *
     * @return 构建统计
     * @throws IOException 任一阶段失败时抛出，此时不会发布新索引
     */
    public IndexStatus finish() throws IOException {
        ensureOpen();
        finished = true;
        List<BlockManifest> blocks = blockBuilder.finish();
        IndexManifest manifest = new BlockMerger(config.getIndexDir(), config.getIndexShardCapacity()).merge(blocks);
        if (!config.isKeepBlocks()) {
            ShardFiles.deleteRecursively(config.getBlocksDir());
        }

        IndexStatus status = new IndexStatus(
            manifest.indexDir(),
            dictionary.docCount(),
            dictionary.termCount(),
            blocks.size(),
            manifest.shardCount(),
            manifest.postingCount(),
            indexSize(manifest));
        logger.info("索引构建完成: docs={}, terms={}, blocks={}, shards={}",
            status.docCount(), status.termCount(), status.blockCount(), status.shardCount());
        return status;
    }

    public DictionaryManager dictionary() {
        return dictionary;
    }

    private long indexSize(IndexManifest manifest) throws IOException {
        long totalBytes = 0L;
        for (int shardIndex = 0; shardIndex < manifest.shardCount(); shardIndex++) {
            totalBytes += Files.size(ShardFiles.shardFile(manifest.indexDir(), shardIndex));
        }
        return totalBytes;
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("InvertedIndexBuilder 已完成");
        }
    }
}
