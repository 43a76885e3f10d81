package com.blockindex.index;

import com.blockindex.dictionary.DictionaryManager;

/**
 * 构建产物：查询所需的内存词典与磁盘索引统计。
 */
public record BuiltIndex(DictionaryManager dictionary, IndexStatus status) {
    public BuiltIndex {
        if (dictionary == null || status == null) {
            throw new IllegalArgumentException("dictionary与status不能为null");
        }
    }
}
