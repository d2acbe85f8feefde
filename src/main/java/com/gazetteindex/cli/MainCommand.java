package com.gazetteindex.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gazetteindex.config.Constants;
import com.gazetteindex.config.EngineConfig;
import com.gazetteindex.index.BuildOptions;
import com.gazetteindex.index.BuildReport;
import com.gazetteindex.index.IndexBuilder;
import com.gazetteindex.index.ShardMeta;
import com.gazetteindex.index.ShardSplitter;
import com.gazetteindex.query.InvalidQueryException;
import com.gazetteindex.query.SearchFilters;
import com.gazetteindex.query.SearchHit;
import com.gazetteindex.query.SearchResult;
import com.gazetteindex.runtime.EngineContext;
import com.gazetteindex.runtime.EngineStatus;
import com.gazetteindex.storage.DateKeys;
import com.gazetteindex.storage.PostingList;
import com.gazetteindex.storage.RowField;
import com.gazetteindex.storage.RowIdOutOfRangeException;
import com.gazetteindex.storage.RowRecord;
import com.gazetteindex.storage.RowStore;
import com.gazetteindex.storage.RowStoreWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.zip.GZIPInputStream;

@Command(
    name = "gzi",
    description = "🔍 公告记录结构化检索引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.RowSubcommand.class,
        MainCommand.PostingsSubcommand.class,
        MainCommand.BuildIndexSubcommand.class,
        MainCommand.ShardSubcommand.class,
        MainCommand.PackSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_INVALID_QUERY = 2;

    @Option(names = {"--data-root"}, description = "数据根目录（默认取 DATA_ROOT 或 ./data）")
    private Path dataRoot;

    @Option(names = {"--row-store"}, description = "行存文件路径（默认取 DOCMETA_BIN）")
    private Path rowStorePath;

    @Option(names = {"--index-root"}, description = "整体索引目录（默认取 INDEX_ROOT）")
    private Path indexRoot;

    @Option(names = {"--shards-root"}, description = "分片索引目录（默认取 SHARDS_ROOT）")
    private Path shardsRoot;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 公告记录结构化检索引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 环境变量给出默认值，命令行参数覆盖。
     */
    EngineConfig resolveConfig() {
        EngineConfig config = EngineConfig.fromEnvironment(System.getenv());
        if (dataRoot != null) {
            config.withDataRoot(dataRoot.toAbsolutePath().normalize());
        }
        if (rowStorePath != null) {
            config.setRowStorePath(rowStorePath.toAbsolutePath().normalize());
        }
        if (indexRoot != null) {
            config.setIndexRoot(indexRoot.toAbsolutePath().normalize());
        }
        if (shardsRoot != null) {
            config.setShardsRoot(shardsRoot.toAbsolutePath().normalize());
        }
        return config;
    }

    static String formatRecord(int rowId, RowRecord record) {
        return String.format("#%d  日期=%s  地点=%d  类型=%d  公司=%d  公告=%d  链接=%d",
            rowId, DateKeys.toDate(record.dateKey()), record.locationCode(), record.typeCode(),
            record.companyCode(), record.adId(), record.adLinkCode());
    }

    @Command(name = "search", description = "🔎 按地点、类型、日期区间与公司检索")
    static class SearchSubcommand implements Callable<Integer> {

        @Option(names = {"--location"}, description = "地点编码")
        private Integer locationCode;

        @Option(names = {"--type"}, description = "公告类型编码")
        private Integer typeCode;

        @Option(names = {"--from"}, description = "起始日期 yyyy-MM-dd（含）")
        private LocalDate dateFrom;

        @Option(names = {"--to"}, description = "结束日期 yyyy-MM-dd（含）")
        private LocalDate dateTo;

        @Option(names = {"--company"}, description = "公司编码")
        private Integer companyCode;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量（1-200，默认 40）")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            SearchFilters filters = new SearchFilters(locationCode, typeCode, dateFrom, dateTo, companyCode, limit);
            try (EngineContext context = EngineContext.open(main.resolveConfig())) {
                SearchResult result = context.search(filters);
                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                    System.out.println();
                    System.out.println("📊 共返回 " + result.count() + " 条，用时 " + result.elapsedMs() + "ms");
                }
                return 0;
            } catch (InvalidQueryException exception) {
                System.err.println("⚠️ " + exception.getMessage());
                return EXIT_INVALID_QUERY;
            } catch (Exception exception) {
                System.err.println("❌ 检索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }
            for (SearchHit hit : result.hits()) {
                System.out.println(formatRecord(hit.rowId(), hit.record()));
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "row", description = "📄 按行号读取一条记录")
    static class RowSubcommand implements Callable<Integer> {

        @Parameters(description = "行号", arity = "1")
        private long rowId;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (EngineContext context = EngineContext.open(main.resolveConfig())) {
                System.out.println(formatRecord((int) rowId, context.getRow(rowId)));
                return 0;
            } catch (RowIdOutOfRangeException exception) {
                System.err.println("⚠️ " + exception.getMessage());
                return EXIT_INVALID_QUERY;
            } catch (Exception exception) {
                System.err.println("❌ 读取失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "postings", description = "📑 查看某个索引键的倒排列表")
    static class PostingsSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "索引名，例如 loc_id、type_id、date_int、comp_code")
        private String indexName;

        @Parameters(index = "1", description = "索引键")
        private int key;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.resolveConfig();
            config.setEagerOpen(false);
            try (EngineContext context = EngineContext.open(config)) {
                PostingList postingList = context.postings(indexName, key);
                System.out.println("📑 " + indexName + "[" + key + "] 共 " + postingList.size() + " 项");
                System.out.println(Arrays.toString(postingList.rowIds()));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取倒排失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "build-index", description = "🏗️ 扫描行存并构建倒排索引（可续跑）")
    static class BuildIndexSubcommand implements Callable<Integer> {

        @Option(names = {"--field"}, description = "分桶字段 (DATE_KEY|LOCATION|TYPE|COMPANY|AD_ID|AD_LINK 或索引名)",
            defaultValue = "COMPANY")
        private String field;

        @Option(names = {"--index-name"}, description = "输出索引名（默认取字段的索引名）")
        private String indexName;

        @Option(names = {"--two-level"}, negatable = true, defaultValue = "true",
            description = "使用两级分片目录 <index>/xx/<key>.json（默认开启）")
        private boolean twoLevel;

        @Option(names = {"--shards-only"}, description = "只写分片，不写整体索引")
        private boolean shardsOnly;

        @Option(names = {"--mono-only"}, description = "只写整体索引，不写分片")
        private boolean monoOnly;

        @Option(names = {"--sample"}, description = "只处理前 N 行（0 表示全部）", defaultValue = "0")
        private int sample;

        @Option(names = {"--progress"}, description = "每扫描 N 行输出一次进度（0 关闭）", defaultValue = "250000")
        private int progressRows;

        @Option(names = {"--progress-files"}, description = "每写出 N 个文件输出一次进度（0 关闭）", defaultValue = "5000")
        private int progressFiles;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (shardsOnly && monoOnly) {
                System.err.println("⚠️ --shards-only 与 --mono-only 不能同时使用");
                return EXIT_INVALID_QUERY;
            }
            RowField rowField;
            try {
                rowField = RowField.fromName(field);
            } catch (IllegalArgumentException exception) {
                System.err.println("⚠️ " + exception.getMessage());
                return EXIT_INVALID_QUERY;
            }
            EngineConfig config = main.resolveConfig();
            BuildOptions options = new BuildOptions(config.getShardsRoot(), config.getIndexRoot())
                .setField(rowField)
                .setIndexName(indexName)
                .setTwoLevel(twoLevel)
                .setWriteShards(!monoOnly)
                .setWriteMonolithic(!shardsOnly)
                .setSampleRows(sample)
                .setProgressRows(progressRows)
                .setProgressFiles(progressFiles);

            System.out.println("🚀 开始构建索引: " + options.getIndexName());
            System.out.println("📁 行存: " + config.getRowStorePath());
            System.out.println("📂 分片目录: " + config.getShardsRoot());
            System.out.println("📂 整体索引目录: " + config.getIndexRoot());
            try (RowStore rowStore = RowStore.open(config.getRowStorePath())) {
                BuildReport report = new IndexBuilder(rowStore).build(options);
                System.out.println("✅ 索引构建完成！");
                System.out.println("📊 统计:");
                System.out.println("   扫描行数: " + report.rowsScanned());
                System.out.println("   不同键数: " + report.distinctKeys());
                System.out.println("   新写文件: " + report.filesWritten());
                System.out.println("   跳过文件: " + report.filesSkipped());
                System.out.println("   整体索引: " + (report.monolithicWritten() ? "已写出" : "未写出"));
                System.out.println("   用时: " + report.elapsedMs() + "ms");
                return 0;
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                System.err.println("⚠️ 构建被中断，已写出的文件完整保留，重新执行即可续跑");
                return Constants.EXIT_CODE_INTERRUPTED;
            } catch (Exception exception) {
                System.err.println("❌ 索引构建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "shard", description = "✂️ 将整体索引拆分为按键分片的文件")
    static class ShardSubcommand implements Callable<Integer> {

        @Option(names = {"--index"}, required = true, description = "整体索引 JSON 文件")
        private Path indexFile;

        @Option(names = {"--out"}, required = true, description = "输出目录（键写为 <key>.json）")
        private Path outputDirectory;

        @Option(names = {"--two-level"}, description = "使用两级目录 xx/<key>.json")
        private boolean twoLevel;

        @Override
        public Integer call() {
            try {
                ShardMeta meta = new ShardSplitter(indexFile, outputDirectory, twoLevel).split();
                System.out.println("✅ 拆分完成: " + meta.keys() + " 个键, " + meta.postingsTotal() + " 个倒排项");
                return 0;
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                System.err.println("⚠️ 拆分被中断，重新执行即可续跑");
                return Constants.EXIT_CODE_INTERRUPTED;
            } catch (Exception exception) {
                System.err.println("❌ 拆分失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "pack", description = "📦 将 JSON Lines 记录打包为定长行存")
    static class PackSubcommand implements Callable<Integer> {

        @Option(names = {"--doc"}, required = true, description = "JSON Lines 输入（.gz 自动解压）")
        private Path input;

        @Option(names = {"--out"}, description = "输出目录（默认取行存所在目录）")
        private Path outputDirectory;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            Path target = outputDirectory != null
                ? outputDirectory.resolve(Constants.ROW_STORE_FILE_NAME)
                : main.resolveConfig().getRowStorePath();
            ObjectMapper mapper = new ObjectMapper();
            try (BufferedReader reader = openInput(input);
                 RowStoreWriter writer = new RowStoreWriter(target)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    writer.write(parseRecord(mapper.readTree(line), lineNumber));
                }
                writer.commit();
                System.out.println("✅ 打包完成: " + writer.getRowCount() + " 行 → " + target);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 打包失败: " + exception.getMessage());
                return 1;
            }
        }

        static RowRecord parseRecord(JsonNode node, int lineNumber) throws IOException {
            return new RowRecord(
                requireInt(node, "date_int", lineNumber),
                requireInt(node, "loc_id", lineNumber),
                requireInt(node, "type_id", lineNumber),
                requireInt(node, "comp_name", lineNumber),
                requireInt(node, "ad_id", lineNumber),
                requireInt(node, "ad_link", lineNumber)
            );
        }

        private static int requireInt(JsonNode node, String fieldName, int lineNumber) throws IOException {
            JsonNode value = node.get(fieldName);
            if (value == null || value.isNull()) {
                throw new IOException("第 " + lineNumber + " 行缺少字段: " + fieldName);
            }
            try {
                return value.isNumber() ? Math.toIntExact(value.longValue()) : Integer.parseInt(value.asText().trim());
            } catch (ArithmeticException | NumberFormatException exception) {
                throw new IOException("第 " + lineNumber + " 行字段不是 int32: " + fieldName + "=" + value, exception);
            }
        }

        private static BufferedReader openInput(Path path) throws IOException {
            InputStream inputStream = Files.newInputStream(path);
            if (path.getFileName().toString().endsWith(".gz")) {
                try {
                    inputStream = new GZIPInputStream(inputStream);
                } catch (IOException exception) {
                    try {
                        inputStream.close();
                    } catch (IOException closeException) {
                        exception.addSuppressed(closeException);
                    }
                    throw exception;
                }
            }
            return new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        }
    }

    @Command(name = "status", description = "📊 查看行存与索引路径状态")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.resolveConfig();
            config.setEagerOpen(false);
            try (EngineContext context = EngineContext.open(config)) {
                if (Files.exists(config.getRowStorePath())) {
                    context.getRowStore().acquire();
                }
                EngineStatus status = context.status();
                System.out.println("📊 引擎状态");
                System.out.println("═══════════");
                System.out.println("✅ 就绪: " + status.ok() + " (" + status.rowStoreState() + ")");
                System.out.println("📄 记录总数: " + status.rows());
                System.out.println("📁 数据目录: " + status.dataRoot());
                System.out.println("💾 行存文件: " + status.rowStorePath());
                System.out.println("📂 整体索引: " + status.indexRoot());
                System.out.println("📂 分片索引: " + status.shardsRoot());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
