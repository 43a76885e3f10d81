package com.blockindex.cli;

import com.blockindex.algebra.PostingRepresentation;
import com.blockindex.config.IndexConfig;
import com.blockindex.index.BuiltIndex;
import com.blockindex.index.CorpusIndexer;
import com.blockindex.index.IndexStatus;
import com.blockindex.query.QueryEngine;
import com.blockindex.query.QueryParseException;
import com.blockindex.query.QueryTermAnalyzer;
import com.blockindex.query.SearchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "block-index",
    description = "🔍 基于块排序（BSBI）的磁盘倒排索引",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.SearchSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "properties 配置文件")
    private Path configFile;

    @Option(names = {"--work-dir"}, description = "工作目录，块与索引写入其下的 blocks/ 与 index/")
    private Path workDir;

    @Option(names = {"--representation"}, description = "倒排表示 (SORTED_LIST|BITSET)")
    private PostingRepresentation representation;

    @Option(names = {"--block-capacity"}, description = "单块缓冲记录数")
    private Integer blockCapacity;

    @Option(names = {"--shard-capacity"}, description = "块分片词条上限")
    private Integer shardCapacity;

    @Option(names = {"--index-shard-capacity"}, description = "索引分片词条上限")
    private Integer indexShardCapacity;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 基于块排序（BSBI）的磁盘倒排索引");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 配置文件为基础，命令行显式参数覆盖。
     */
    IndexConfig resolveConfig() throws IOException {
        IndexConfig config = configFile == null ? IndexConfig.defaults() : IndexConfig.load(configFile);
        if (workDir != null) {
            config.setWorkDir(workDir);
        }
        if (representation != null) {
            config.setRepresentation(representation);
        }
        if (blockCapacity != null) {
            config.setBlockCapacity(blockCapacity);
        }
        if (shardCapacity != null) {
            config.setBlockShardCapacity(shardCapacity);
        }
        if (indexShardCapacity != null) {
            config.setIndexShardCapacity(indexShardCapacity);
        }
        return config;
    }

    @Command(name = "index", description = "📂 构建索引并输出统计")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "语料目录", arity = "1")
        private Path corpusDir;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                System.out.println("🚀 开始索引...");
                System.out.println("📂 语料目录: " + corpusDir);
                System.out.println("📁 索引目录: " + config.getIndexDir());

                long start = System.currentTimeMillis();
                BuiltIndex builtIndex = new CorpusIndexer(config).build(corpusDir);
                long elapsed = System.currentTimeMillis() - start;
                IndexStatus status = builtIndex.status();

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   文档数: " + status.docCount());
                System.out.println("   词条数: " + status.termCount());
                System.out.println("   块数量: " + status.blockCount());
                System.out.println("   分片数: " + status.shardCount());
                System.out.println("   索引大小: " + formatBytes(status.indexSizeBytes()));
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    @Command(name = "search", description = "🔎 构建索引并执行布尔查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料目录")
        private Path corpusDir;

        @Parameters(index = "1..*", description = "查询语句，如 \"input AND NOT users\"", arity = "1..*")
        private List<String> queries;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                BuiltIndex builtIndex = new CorpusIndexer(config).build(corpusDir);
                QueryEngine queryEngine = new QueryEngine(builtIndex, config.getRepresentation(),
                    QueryTermAnalyzer.forConfig(config));

                List<SearchResult> results = new ArrayList<>(queries.size());
                for (String query : queries) {
                    results.add(queryEngine.search(query.trim()));
                }

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(results);
                } else {
                    for (SearchResult result : results) {
                        printTextResult(result);
                    }
                }
                return 0;
            } catch (QueryParseException exception) {
                System.err.println("❌ 查询语法错误: " + exception.getMessage());
                System.err.println("💡 " + exception.getSuggestion());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            System.out.println("🔍 查询: \"" + result.query() + "\"");
            if (result.documents().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
            } else {
                int rank = 1;
                for (Path document : result.documents()) {
                    System.out.printf("%d. %s%n", rank++, document);
                }
            }
            System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
            System.out.println();
        }

        private void printJsonResult(List<SearchResult> results) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            ArrayNode root = mapper.createArrayNode();
            for (SearchResult result : results) {
                ObjectNode node = root.addObject();
                node.put("query", result.query());
                node.put("totalMatches", result.totalMatches());
                node.put("elapsedMs", result.elapsedMs());
                ArrayNode documents = node.putArray("documents");
                for (Path document : result.documents()) {
                    documents.add(document.toString());
                }
            }
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        }
    }
}
