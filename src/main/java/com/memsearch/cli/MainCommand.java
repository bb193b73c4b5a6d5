package com.memsearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memsearch.config.Constants;
import com.memsearch.config.EngineConfig;
import com.memsearch.document.CorpusLoader;
import com.memsearch.document.InMemoryCorpus;
import com.memsearch.index.InMemoryInvertedIndex;
import com.memsearch.index.IndexStatus;
import com.memsearch.index.PostingList;
import com.memsearch.query.QueryEngine;
import com.memsearch.query.QueryNode;
import com.memsearch.query.QueryParseException;
import com.memsearch.query.SearchHit;
import com.memsearch.query.SearchResult;
import com.memsearch.text.LowercaseNormalizer;
import com.memsearch.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "mse",
    description = "🔍 内存倒排索引与布尔检索",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.PostingsSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    /** 查询语法错误的退出码 */
    static final int EXIT_QUERY_ERROR = 2;

    @Option(names = {"--fields"}, description = "要索引的字段，逗号分隔", split = ",", defaultValue = "body")
    private List<String> fields;

    @Option(names = {"--threads"}, description = "索引线程数", defaultValue = "1")
    private int threads;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * 创建命令行实例。--operator 与查询中的 AND/OR 一样不区分大小写。
     */
    static CommandLine newCommandLine() {
        return new CommandLine(new MainCommand()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 内存倒排索引与布尔检索");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setFields(fields == null || fields.isEmpty() ? Constants.DEFAULT_FIELDS : fields);
        config.setIndexThreads(resolveThreadCount());
        return config;
    }

    InMemoryInvertedIndex buildIndex(Path corpusFile, EngineConfig config) throws IOException {
        InMemoryCorpus corpus = new CorpusLoader().load(corpusFile);
        return new InMemoryInvertedIndex(corpus, config.getFields(), new LowercaseNormalizer(), new WordTokenizer(),
            config.getIndexThreads());
    }

    private int resolveThreadCount() {
        if (threads <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", threads, Constants.DEFAULT_INDEX_THREADS);
            return Constants.DEFAULT_INDEX_THREADS;
        }
        if (threads > Constants.MAX_INDEX_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", threads, Constants.MAX_INDEX_THREADS);
            return Constants.MAX_INDEX_THREADS;
        }
        return threads;
    }

    private int sanitizeSearchLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "search", description = "🔎 执行布尔查询并按命中次数排序")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（.txt / .xml / .json）")
        private Path corpusFile;

        @Parameters(index = "1", description = "查询语句，支持 AND、OR 与括号")
        private String query;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制", defaultValue = "10")
        private int limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--operator"}, description = "相邻查询词的默认操作符 (AND|OR)", defaultValue = "AND")
        private QueryNode.BoolOp operator;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.buildConfig();
                config.setDefaultOperator(operator);
                String safeQuery = main.sanitizeQuery(query);
                int safeLimit = main.sanitizeSearchLimit(limit);
                config.setQueryLimit(safeLimit);

                InMemoryInvertedIndex index = main.buildIndex(corpusFile, config);
                QueryEngine queryEngine = new QueryEngine(index, index.getCorpus(), config);
                SearchResult result = queryEngine.search(safeQuery, config.getQueryLimit());

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                    return 0;
                }
                System.out.println("🔍 查询: \"" + safeQuery + "\"");
                System.out.println();
                printTextResult(result);
                System.out.println();
                System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (QueryParseException exception) {
                System.err.println("❌ 查询语法错误: " + exception.getMessage());
                System.err.println("💡 " + exception.getSuggestion());
                return EXIT_QUERY_ERROR;
            } catch (Exception exception) {
                logger.error("搜索失败", exception);
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.println("─────────────────────────────────");
                System.out.printf("%d. doc#%d (score: %.1f)%n", rank++, hit.documentId(), hit.score());
                for (var field : hit.document().fields().entrySet()) {
                    System.out.println("   " + field.getKey() + ": " + field.getValue().replace("\n", " "));
                }
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "postings", description = "📜 打印文本中每个词项的倒排列表")
    static class PostingsSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（.txt / .xml / .json）")
        private Path corpusFile;

        @Parameters(index = "1", description = "要查看的文本，按索引时相同的方式切分")
        private String text;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                InMemoryInvertedIndex index = main.buildIndex(corpusFile, main.buildConfig());
                for (String term : index.getTerms(text)) {
                    PostingList postingList = index.getPostingList(term);
                    System.out.println("*** " + term + " (df=" + index.getDocumentFrequency(term) + ")");
                    System.out.println("   " + postingList);
                }
                return 0;
            } catch (Exception exception) {
                logger.error("读取倒排失败", exception);
                System.err.println("❌ 读取倒排失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（.txt / .xml / .json）")
        private Path corpusFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.buildConfig();
                IndexStatus status = main.buildIndex(corpusFile, config).getStatus();

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 语料文件: " + corpusFile);
                System.out.println("🏷️ 索引字段: " + String.join(",", config.getFields()));
                System.out.println("📄 文档总数: " + status.documentCount());
                System.out.println("🔤 词项总数: " + status.termCount());
                System.out.println("📦 倒排项总数: " + status.postingCount());
                return 0;
            } catch (Exception exception) {
                logger.error("获取状态失败", exception);
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
