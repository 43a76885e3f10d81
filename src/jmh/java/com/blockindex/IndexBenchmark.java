package com.blockindex;

import com.blockindex.algebra.PostingRepresentation;
import com.blockindex.config.IndexConfig;
import com.blockindex.index.BuiltIndex;
import com.blockindex.index.CorpusIndexer;
import com.blockindex.query.QueryEngine;
import com.blockindex.storage.ShardFiles;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * 索引构建与布尔查询基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Thread)
    public static class IndexState {
        Path tempDir;
        Path corpusDir;
        IndexConfig config;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            corpusDir = Files.createDirectories(tempDir.resolve("corpus"));

            // 1000 个文档，小块容量以产生多块合并
            for (int i = 0; i < 1000; i++) {
                Files.writeString(corpusDir.resolve("doc" + i + ".txt"), generateDocument(i));
            }

            config = IndexConfig.defaults();
            config.setWorkDir(tempDir.resolve("work"));
            config.setBlockCapacity(5_000);
        }

        @TearDown
        public void tearDown() throws IOException {
            ShardFiles.deleteRecursively(tempDir);
        }

        private String generateDocument(int index) {
            return "Document " + index + " content. "
                + "This is a test document for benchmarking. "
                + "It contains various words like Java, Python, programming, "
                + "search, index, document, file, content, data, "
                + "performance, benchmark, test, example. "
                + "The quick brown fox jumps over the lazy dog. "
                + " repeated text to increase size.".repeat(5);
        }
    }

    @Benchmark
    public int indexThroughput(IndexState state) throws IOException {
        return new CorpusIndexer(state.config).build(state.corpusDir).status().termCount();
    }

    @State(Scope.Benchmark)
    public static class QueryLatencyState {
        @Param({"SORTED_LIST", "BITSET"})
        PostingRepresentation representation;

        Path tempDir;
        QueryEngine queryEngine;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            Path corpusDir = Files.createDirectories(tempDir.resolve("corpus"));

            for (int i = 0; i < 10000; i++) {
                String content = "Document " + i + " about "
                    + (i % 10 == 0 ? "Java programming"
                        : i % 10 == 1 ? "Python data science"
                        : i % 10 == 2 ? "machine learning"
                        : "general content")
                    + " with various keywords for search testing.";
                Files.writeString(corpusDir.resolve("doc" + i + ".txt"), content);
            }

            IndexConfig config = IndexConfig.defaults();
            config.setWorkDir(tempDir.resolve("work"));
            BuiltIndex builtIndex = new CorpusIndexer(config).build(corpusDir);
            queryEngine = new QueryEngine(builtIndex, representation);
        }

        @TearDown
        public void tearDown() throws IOException {
            ShardFiles.deleteRecursively(tempDir);
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencySimple(QueryLatencyState state) throws IOException {
        return state.queryEngine.search("Java").totalMatches();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyBoolean(QueryLatencyState state) throws IOException {
        return state.queryEngine.search("Java AND programming").totalMatches();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyNegation(QueryLatencyState state) throws IOException {
        return state.queryEngine.search("search AND NOT (Python OR machine)").totalMatches();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
