package com.blockindex.query;

import com.blockindex.algebra.PostingAlgebra;
import com.blockindex.algebra.PostingRepresentation;
import com.blockindex.algebra.SortedListAlgebra;
import com.blockindex.config.IndexConfig;
import com.blockindex.dictionary.DictionaryManager;
import com.blockindex.index.BuiltIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * 查询引擎：词项按建索引的规则切分后经词典转换为 termId，从最终索引取倒排，再用所选表示的布尔代数组合。
 *
 * 未知词项返回空结果而不是错误；分片读取失败以 IOException 交给调用方。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);
    private static final int[] NO_DOCS = new int[0];

    private final DictionaryManager dictionary;
    private final IndexReader indexReader;
    private final QueryTermAnalyzer termAnalyzer;
    private final PostingAlgebra<?> algebra;

    /**
     * 基于构建产物打开查询引擎，使用默认配置的词项切分规则。
     *
     * @throws IOException 索引目录不可读时抛出
     */
    public QueryEngine(BuiltIndex builtIndex, PostingRepresentation representation) throws IOException {
        this(builtIndex, representation, QueryTermAnalyzer.forConfig(IndexConfig.defaults()));
    }

    public QueryEngine(BuiltIndex builtIndex, PostingRepresentation representation,
                       QueryTermAnalyzer termAnalyzer) throws IOException {
        this(builtIndex.dictionary(), new IndexReader(builtIndex.status().indexDir()), representation, termAnalyzer);
    }

    public QueryEngine(DictionaryManager dictionary, IndexReader indexReader,
                       PostingRepresentation representation, QueryTermAnalyzer termAnalyzer) {
        if (dictionary == null || indexReader == null || representation == null || termAnalyzer == null) {
            throw new IllegalArgumentException("dictionary、indexReader、representation与termAnalyzer不能为null");
        }
        this.dictionary = dictionary;
        this.indexReader = indexReader;
        this.termAnalyzer = termAnalyzer;
        this.algebra = representation.newAlgebra(dictionary.allDocIds());
    }

    public PostingRepresentation representation() {
        return algebra.representation();
    }

    /**
     * 查找单个词项，返回包含它的文档路径。
     *
     * @param term 词项
     * @return 文档路径，未知词项返回空列表
     * @throws IOException 读取索引失败时抛出
     */
    public List<Path> lookup(String term) throws IOException {
        return toPaths(lookupDocIds(term));
    }

    /**
     * 查找单个词项，返回升序文档 ID。
     *
     * 词项切成多个词时取各词倒排的交集；切不出可索引的词时没有命中。
     */
    public int[] lookupDocIds(String term) throws IOException {
        List<String> terms = termAnalyzer.analyze(term);
        if (terms.isEmpty()) {
            logger.debug("词项不含可索引内容: {}", term);
            return NO_DOCS;
        }
        int[] docIds = null;
        for (String analyzed : terms) {
            OptionalInt termId = dictionary.findTermId(analyzed);
            if (termId.isEmpty()) {
                logger.debug("未知词项: {}", analyzed);
                return NO_DOCS;
            }
            int[] postings = indexReader.lookup(termId.getAsInt());
            docIds = docIds == null ? postings : SortedListAlgebra.intersect(docIds, postings);
            if (docIds.length == 0) {
                break;
            }
        }
        return docIds;
    }

    /**
     * 计算布尔表达式，返回命中的文档路径（按 docId 升序）。
     */
    public List<Path> evaluate(QueryNode node) throws IOException {
        return toPaths(evaluateDocIds(node));
    }

    /**
     * 计算布尔表达式，返回升序文档 ID。
     */
    public int[] evaluateDocIds(QueryNode node) throws IOException {
        if (node == null) {
            throw new IllegalArgumentException("查询节点不能为null");
        }
        return evaluateWith(algebra, node);
    }

    /**
     * 解析并执行查询字符串。
     *
     * @throws QueryParseException 查询语法错误时抛出
     * @throws IOException 读取索引失败时抛出
     */
    public SearchResult search(String queryString) throws IOException {
        long startNanos = System.nanoTime();
        QueryNode ast = new QueryParser().parse(queryString);
        List<Path> documents = evaluate(ast);
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        return new SearchResult(queryString, documents, documents.size(), elapsedMs);
    }

    private <P> int[] evaluateWith(PostingAlgebra<P> typedAlgebra, QueryNode node) throws IOException {
        return typedAlgebra.toDocIds(evaluateNode(typedAlgebra, node));
    }

    private <P> P evaluateNode(PostingAlgebra<P> typedAlgebra, QueryNode node) throws IOException {
        if (node instanceof QueryNode.TermQuery termQuery) {
            return typedAlgebra.fromDocIds(lookupDocIds(termQuery.term()));
        }
        if (node instanceof QueryNode.NotQuery notQuery) {
            return typedAlgebra.not(evaluateNode(typedAlgebra, notQuery.child()));
        }
        if (node instanceof QueryNode.BooleanQuery booleanQuery) {
            P left = evaluateNode(typedAlgebra, booleanQuery.left());
            P right = evaluateNode(typedAlgebra, booleanQuery.right());
            if (booleanQuery.op() == QueryNode.BoolOp.AND) {
                return typedAlgebra.and(left, right);
            }
            return typedAlgebra.or(left, right);
        }
        throw new IllegalArgumentException("不支持的查询节点: " + node);
    }

    private List<Path> toPaths(int[] docIds) throws IOException {
        List<Path> paths = new ArrayList<>(docIds.length);
        for (int docId : docIds) {
            paths.add(dictionary.docPath(docId)
                .orElseThrow(() -> new IOException("文档不存在: docId=" + docId)));
        }
        return paths;
    }
}
