package com.blockindex.storage;

import java.util.List;

/**
 * 分片：按 termId 严格递增的一段词条序列，磁盘读写的最小单位。
 *
 * @param entries 词条列表
 */
public record Shard(List<IndexEntry> entries) {
    public Shard {
        if (entries == null) {
            throw new IllegalArgumentException("entries不能为null");
        }
        entries = List.copyOf(entries);
        for (int index = 1; index < entries.size(); index++) {
            int previousTermId = entries.get(index - 1).termId();
            int currentTermId = entries.get(index).termId();
            if (currentTermId <= previousTermId) {
                throw new IllegalArgumentException("分片内termId必须严格递增，位置=" + index
                    + ", previous=" + previousTermId + ", current=" + currentTermId);
            }
        }
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public IndexEntry entry(int index) {
        return entries.get(index);
    }

    /**
     * 首个词条的 termId，分片间排序依据。
     *
     * @throws IllegalStateException 空分片时抛出
     */
    public int firstTermId() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("空分片没有首词条");
        }
        return entries.get(0).termId();
    }

    /**
     * 末尾词条的 termId。
     *
     * @throws IllegalStateException 空分片时抛出
     */
    public int lastTermId() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("空分片没有末词条");
        }
        return entries.get(entries.size() - 1).termId();
    }
}
