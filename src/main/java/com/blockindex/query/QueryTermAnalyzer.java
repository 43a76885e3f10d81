package com.blockindex.query;

import com.blockindex.config.IndexConfig;
import com.blockindex.text.PunctuationFilter;
import com.blockindex.text.SimpleTokenizer;
import com.blockindex.text.Token;
import com.blockindex.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * 把查询词项切成与索引一致的词：使用建索引时的分词器与标点过滤规则。
 *
 * 例如 "был." 得到 [был]，"e-mail" 得到 [e, -, mail]。
 */
public final class QueryTermAnalyzer {
    private final Tokenizer tokenizer;
    private final PunctuationFilter punctuationFilter;

    public QueryTermAnalyzer(Tokenizer tokenizer, PunctuationFilter punctuationFilter) {
        if (tokenizer == null || punctuationFilter == null) {
            throw new IllegalArgumentException("tokenizer与punctuationFilter不能为null");
        }
        this.tokenizer = tokenizer;
        this.punctuationFilter = punctuationFilter;
    }

    /**
     * 默认分词器加配置中的标点集合，与 {@code CorpusIndexer(IndexConfig)} 的建索引规则相同。
     */
    public static QueryTermAnalyzer forConfig(IndexConfig config) {
        return new QueryTermAnalyzer(new SimpleTokenizer(), new PunctuationFilter(config.getPunctuation()));
    }

    /**
     * @param term 查询中的原始词项
     * @return 可索引的词，按出现顺序；全部是标点或空白时为空列表
     */
    public List<String> analyze(String term) {
        List<String> terms = new ArrayList<>();
        for (Token token : tokenizer.tokenize(term)) {
            if (punctuationFilter.isIndexable(token)) {
                terms.add(token.text());
            }
        }
        return terms;
    }
}
