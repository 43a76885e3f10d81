package com.blockindex.dictionary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 词项与文档的 ID 分配器。
 *
 * 首次出现时按顺序分配从 0 开始的连续 ID，之后返回已有 ID；一次构建内不回收、不重分配。
 * 非线程安全，构建期间只允许单个写入线程。
 */
public final class DictionaryManager {
    private final Map<String, Integer> termIds = new HashMap<>();
    private final Map<Path, Integer> docIds = new HashMap<>();
    private final List<Path> docPaths = new ArrayList<>();

    /**
     * 返回词项 ID，首次出现时分配新的 ID。
     *
     * @param term 规范化后的词项
     * @return 词项 ID
     */
    public int assignTerm(String term) {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        Integer existing = termIds.get(term);
        if (existing != null) {
            return existing;
        }
        int termId = termIds.size();
        termIds.put(term, termId);
        return termId;
    }

    /**
     * 返回文档 ID，首次出现时分配新的 ID。
     *
     * @param path 文档源路径
     * @return 文档 ID
     */
    public int assignDoc(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("文档路径不能为空");
        }
        Integer existing = docIds.get(path);
        if (existing != null) {
            return existing;
        }
        int docId = docPaths.size();
        docIds.put(path, docId);
        docPaths.add(path);
        return docId;
    }

    /**
     * 查找词项 ID，不分配。
     */
    public OptionalInt findTermId(String term) {
        Integer termId = term == null ? null : termIds.get(term);
        return termId == null ? OptionalInt.empty() : OptionalInt.of(termId);
    }

    /**
     * 查找文档 ID，不分配。
     */
    public OptionalInt findDocId(Path path) {
        Integer docId = path == null ? null : docIds.get(path);
        return docId == null ? OptionalInt.empty() : OptionalInt.of(docId);
    }

    /**
     * 按 ID 反查文档路径。
     */
    public Optional<Path> docPath(int docId) {
        if (docId < 0 || docId >= docPaths.size()) {
            return Optional.empty();
        }
        return Optional.of(docPaths.get(docId));
    }

    public int termCount() {
        return termIds.size();
    }

    public int docCount() {
        return docPaths.size();
    }

    /**
     * 返回全部文档 ID（升序 0..docCount-1），NOT 运算的全集。
     */
    public int[] allDocIds() {
        int[] allDocIds = new int[docPaths.size()];
        for (int docId = 0; docId < allDocIds.length; docId++) {
            allDocIds[docId] = docId;
        }
        return allDocIds;
    }
}
