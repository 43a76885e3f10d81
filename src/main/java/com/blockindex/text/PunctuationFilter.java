package com.blockindex.text;

import java.util.Set;

/**
 * 按固定标点集合过滤 token，只判断文本本身，不依赖分词器的标点标记。
 */
public final class PunctuationFilter {
    private final Set<String> punctuation;

    public PunctuationFilter(Set<String> punctuation) {
        if (punctuation == null) {
            throw new IllegalArgumentException("标点集合不能为null");
        }
        this.punctuation = Set.copyOf(punctuation);
    }

    /**
     * 判断 token 是否应进入索引。
     */
    public boolean isIndexable(Token token) {
        return token != null && isIndexable(token.text());
    }

    /**
     * 判断文本是否应进入索引：非空且不在标点集合中。
     */
    public boolean isIndexable(String text) {
        return text != null && !text.isBlank() && !punctuation.contains(text);
    }
}
