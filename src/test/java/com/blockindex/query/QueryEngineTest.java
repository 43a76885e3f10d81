package com.blockindex.query;

import com.blockindex.algebra.PostingRepresentation;
import com.blockindex.config.IndexConfig;
import com.blockindex.dictionary.DictionaryManager;
import com.blockindex.index.BuiltIndex;
import com.blockindex.index.IndexStatus;
import com.blockindex.index.InvertedIndexBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询引擎单元测试，两种倒排表示跑同一组用例。
 */
class QueryEngineTest {

    private static final Path DOC0 = Paths.get("doc0.txt");
    private static final Path DOC1 = Paths.get("doc1.txt");
    private static final Path DOC2 = Paths.get("doc2.txt");

    @TempDir
    Path tempDir;

    private BuiltIndex builtIndex;

    @BeforeEach
    void setUp() throws IOException {
        IndexConfig config = IndexConfig.defaults();
        config.setWorkDir(tempDir);
        config.setBlockCapacity(2);
        config.setBlockShardCapacity(1);
        config.setIndexShardCapacity(1);

        InvertedIndexBuilder builder = new InvertedIndexBuilder(config);
        addDocument(builder, DOC0, "input", "users");
        addDocument(builder, DOC1, "был", "input");
        addDocument(builder, DOC2, "был", "users");
        IndexStatus status = builder.finish();
        builtIndex = new BuiltIndex(builder.dictionary(), status);
    }

    @ParameterizedTest
    @EnumSource(PostingRepresentation.class)
    void testLookup(PostingRepresentation representation) throws IOException {
        QueryEngine engine = new QueryEngine(builtIndex, representation);

        assertEquals(representation, engine.representation());
        assertEquals(List.of(DOC1, DOC2), engine.lookup("был"));
        assertEquals(List.of(DOC0, DOC1), engine.lookup("input"));
        assertEquals(List.of(), engine.lookup("missing"));
        assertArrayEquals(new int[0], engine.lookupDocIds("Input"));
    }

    @ParameterizedTest
    @EnumSource(PostingRepresentation.class)
    @DisplayName("布尔组合")
    void testEvaluate(PostingRepresentation representation) throws IOException {
        QueryEngine engine = new QueryEngine(builtIndex, representation);

        assertEquals(List.of(DOC0), engine.evaluate(QueryNode.and(QueryNode.term("input"), QueryNode.term("users"))));
        assertEquals(List.of(DOC1, DOC2), engine.evaluate(QueryNode.or(
            QueryNode.term("был"),
            QueryNode.not(QueryNode.and(QueryNode.term("input"), QueryNode.term("users"))))));
        assertEquals(List.of(DOC0), engine.evaluate(QueryNode.not(QueryNode.term("был"))));
        assertEquals(List.of(DOC0, DOC1, DOC2), engine.evaluate(QueryNode.not(QueryNode.term("missing"))));
        assertEquals(List.of(), engine.evaluate(QueryNode.and(QueryNode.term("был"), QueryNode.term("missing"))));
    }

    @ParameterizedTest
    @EnumSource(PostingRepresentation.class)
    void testSearch(PostingRepresentation representation) throws IOException {
        QueryEngine engine = new QueryEngine(builtIndex, representation);

        SearchResult result = engine.search("\"был\" OR NOT(\"input\" AND \"users\")");

        assertEquals(List.of(DOC1, DOC2), result.documents());
        assertEquals(2, result.totalMatches());
        assertTrue(result.elapsedMs() >= 0);
        assertEquals(List.of(DOC2), engine.search("был -input").documents());
        assertThrows(QueryParseException.class, () -> engine.search("(был"));
    }

    @ParameterizedTest
    @EnumSource(PostingRepresentation.class)
    @DisplayName("词项中的标点不影响命中，切出的多个词取交集")
    void testLookupAnalyzesTerm(PostingRepresentation representation) throws IOException {
        QueryEngine engine = new QueryEngine(builtIndex, representation);

        assertEquals(List.of(DOC1, DOC2), engine.lookup("был."));
        assertEquals(List.of(DOC1), engine.lookup("был,input"));
        assertEquals(List.of(), engine.lookup("был—missing"));
        assertEquals(List.of(), engine.lookup("."));
        assertEquals(List.of(DOC0), engine.search("NOT \"был!\"").documents());
    }

    @ParameterizedTest
    @EnumSource(PostingRepresentation.class)
    void testEmptyIndex(PostingRepresentation representation) throws IOException {
        IndexConfig config = IndexConfig.defaults();
        config.setWorkDir(tempDir.resolve("empty"));
        IndexStatus status = new InvertedIndexBuilder(config).finish();
        QueryEngine engine = new QueryEngine(new DictionaryManager(), new IndexReader(status.indexDir()),
            representation, QueryTermAnalyzer.forConfig(config));

        assertEquals(List.of(), engine.lookup("input"));
        assertEquals(List.of(), engine.evaluate(QueryNode.not(QueryNode.term("input"))));
    }

    @ParameterizedTest
    @EnumSource(PostingRepresentation.class)
    void testNullNodeIsRejected(PostingRepresentation representation) throws IOException {
        QueryEngine engine = new QueryEngine(builtIndex, representation);
        assertThrows(IllegalArgumentException.class, () -> engine.evaluate(null));
    }

    private static void addDocument(InvertedIndexBuilder builder, Path path, String... tokens) throws IOException {
        int docId = builder.addDocument(path);
        for (String token : tokens) {
            builder.addToken(docId, token);
        }
    }
}
