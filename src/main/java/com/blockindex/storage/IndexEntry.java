package com.blockindex.storage;

import java.util.Arrays;

/**
 * 倒排词条：词项 ID 及其文档 ID 列表。
 *
 * @param termId 词项 ID
 * @param docIds 文档 ID 数组；块内可含重复，最终索引中升序且无重复
 */
public record IndexEntry(int termId, int[] docIds) {
    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public IndexEntry {
        if (termId < 0) {
            throw new IllegalArgumentException("termId不能为负数: " + termId);
        }
        if (docIds == null) {
            throw new IllegalArgumentException("docIds不能为null");
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
    }

    /**
     * 返回文档数量。
     */
    public int postingCount() {
        return docIds.length;
    }

    /**
     * 获取指定位置的文档ID。
     */
    public int docId(int index) {
        return docIds[index];
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IndexEntry that)) {
            return false;
        }
        return termId == that.termId && Arrays.equals(docIds, that.docIds);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(termId) + Arrays.hashCode(docIds);
    }

    @Override
    public String toString() {
        return "IndexEntry[termId=" + termId + ", docIds=" + Arrays.toString(docIds) + "]";
    }
}
