package com.blockindex.index;

import com.blockindex.config.IndexConfig;
import com.blockindex.text.PlainTextExtractor;
import com.blockindex.text.SimpleTokenizer;
import com.blockindex.text.TextExtractor;
import com.blockindex.text.Token;
import com.blockindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 语料目录索引入口：发现文件、提取文本、分词，并把 token 流交给 {@link InvertedIndexBuilder}。
 */
public class CorpusIndexer {
    private static final Logger logger = LoggerFactory.getLogger(CorpusIndexer.class);

    private final IndexConfig config;
    private final TextExtractor textExtractor;
    private final Tokenizer tokenizer;

    /**
     * 使用纯文本提取器与通用分词器。
     */
    public CorpusIndexer(IndexConfig config) {
        this(config, new PlainTextExtractor(), new SimpleTokenizer());
    }

    public CorpusIndexer(IndexConfig config, TextExtractor textExtractor, Tokenizer tokenizer) {
        if (config == null || textExtractor == null || tokenizer == null) {
            throw new IllegalArgumentException("config、textExtractor与tokenizer不能为null");
        }
        this.config = config;
        this.textExtractor = textExtractor;
        this.tokenizer = tokenizer;
    }

    /**
     * 对目录下（不递归）的全部常规文件建索引，文件按路径排序决定 docId。
     *
     * @param corpusDir 语料目录
     * @return 词典与构建统计
     * @throws IOException 目录不可读、文本提取失败或落盘失败时抛出
     */
    public BuiltIndex build(Path corpusDir) throws IOException {
        List<Path> files = discoverFiles(corpusDir);
        logger.info("开始索引 {} 个文档: {}", files.size(), corpusDir);

        InvertedIndexBuilder builder = new InvertedIndexBuilder(config);
        for (Path file : files) {
            int docId = builder.addDocument(file);
            String text = textExtractor.extract(file);
            List<Token> tokens = tokenizer.tokenize(text);
            int indexedCount = builder.addTokens(docId, tokens);
            logger.debug("{}: tokens={}, indexed={}", file, tokens.size(), indexedCount);
        }
        IndexStatus status = builder.finish();
        return new BuiltIndex(builder.dictionary(), status);
    }

    /**
     * 列出语料目录下的常规文件，按路径排序。
     */
    static List<Path> discoverFiles(Path corpusDir) throws IOException {
        if (corpusDir == null || !Files.isDirectory(corpusDir)) {
            throw new IOException("语料目录不存在或不是目录: " + corpusDir);
        }
        try (Stream<Path> entries = Files.list(corpusDir)) {
            return entries
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
