package com.gazetteindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazetteindex.query.SearchResult;
import com.gazetteindex.storage.DateKeys;
import com.gazetteindex.storage.RowRecord;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--data-root", tempDir.toString(),
            "search", "--location", "1", "--from", "2021-06-01", "--to", "2021-06-03");

        assertNotNull(parseResult.subcommand());
        assertEquals("search", parseResult.subcommand().commandSpec().name());
        assertEquals(LocalDate.of(2021, 6, 1), parseResult.subcommand().matchedOptionValue("--from", null));
    }

    @Test
    void testPackBuildSearchRowAndStatus() throws Exception {
        Path dataRoot = tempDir.resolve("data");
        Path input = tempDir.resolve("records.jsonl");
        int dayKey = DateKeys.toKey(LocalDate.of(2021, 6, 1));
        Files.writeString(input, String.join("\n",
            "{\"date_int\":" + dayKey + ",\"loc_id\":1,\"type_id\":1,\"comp_name\":5,\"ad_id\":1,\"ad_link\":\"0\"}",
            "",
            "{\"date_int\":" + dayKey + ",\"loc_id\":2,\"type_id\":1,\"comp_name\":5,\"ad_id\":2,\"ad_link\":0}",
            "{\"date_int\":" + (dayKey + 86_400) + ",\"loc_id\":1,\"type_id\":1,\"comp_name\":5,\"ad_id\":3,\"ad_link\":0}"));

        assertEquals(0, run("--data-root", dataRoot.toString(), "pack", "--doc", input.toString()));
        assertTrue(Files.exists(dataRoot.resolve("docmeta").resolve("docmeta.bin")));
        assertTrue(Files.exists(dataRoot.resolve("docmeta").resolve("meta.json")));

        assertEquals(0, run("--data-root", dataRoot.toString(), "build-index", "--field", "loc_id", "--progress", "0"));
        assertEquals("[0,2]", Files.readString(dataRoot.resolve("index_sharded").resolve("loc_id").resolve("01").resolve("1.json")));
        assertTrue(Files.exists(dataRoot.resolve("index").resolve("loc_id.json")));

        String searchOutput = captureOutput(() -> run("--data-root", dataRoot.toString(), "search", "--location", "1"));
        assertTrue(searchOutput.contains("#0 "));
        assertTrue(searchOutput.contains("#2 "));
        assertTrue(searchOutput.contains("共返回 2 条"));

        String jsonOutput = captureOutput(() -> run("--data-root", dataRoot.toString(),
            "search", "--location", "2", "--format", "json"));
        assertEquals(1, new ObjectMapper().readTree(jsonOutput).get("count").asInt());

        String rowOutput = captureOutput(() -> run("--data-root", dataRoot.toString(), "row", "1"));
        assertTrue(rowOutput.contains("地点=2"));
        assertEquals(MainCommand.EXIT_INVALID_QUERY, run("--data-root", dataRoot.toString(), "row", "3"));

        String postingsOutput = captureOutput(() -> run("--data-root", dataRoot.toString(), "postings", "loc_id", "1"));
        assertTrue(postingsOutput.contains("[0, 2]"));

        String statusOutput = captureOutput(() -> run("--data-root", dataRoot.toString(), "status"));
        assertTrue(statusOutput.contains("记录总数: 3"));
    }

    @Test
    void testSearchWithoutIndexedFilterReturnsTwo() throws Exception {
        Path dataRoot = tempDir.resolve("data");
        Path input = tempDir.resolve("records.jsonl");
        Files.writeString(input, "{\"date_int\":0,\"loc_id\":1,\"type_id\":1,\"comp_name\":5,\"ad_id\":1,\"ad_link\":0}\n");
        assertEquals(0, run("--data-root", dataRoot.toString(), "pack", "--doc", input.toString()));

        assertEquals(MainCommand.EXIT_INVALID_QUERY, run("--data-root", dataRoot.toString(), "search", "--company", "5"));
        assertEquals(MainCommand.EXIT_INVALID_QUERY, run("--data-root", dataRoot.toString(),
            "search", "--location", "1", "--from", "2021-06-01"));
    }

    @Test
    void testBuildIndexRejectsConflictingModes() {
        assertEquals(MainCommand.EXIT_INVALID_QUERY, run("--data-root", tempDir.toString(),
            "build-index", "--shards-only", "--mono-only"));
    }

    @Test
    void testBuildIndexRejectsUnknownField() {
        assertEquals(MainCommand.EXIT_INVALID_QUERY, run("--data-root", tempDir.toString(),
            "build-index", "--field", "no_such_field"));
    }

    @Test
    void testPackRejectsCorruptGzipInput() throws IOException {
        Path input = tempDir.resolve("records.jsonl.gz");
        Files.writeString(input, "{\"date_int\":0}\n");
        Path outputDirectory = tempDir.resolve("packed");

        assertEquals(1, run("pack", "--doc", input.toString(), "--out", outputDirectory.toString()));
        assertTrue(Files.notExists(outputDirectory.resolve("docmeta.bin")));
    }

    @Test
    void testBuildIndexWithoutRowStoreFails() {
        assertEquals(1, run("--data-root", tempDir.resolve("missing").toString(), "build-index"));
    }

    @Test
    void testShardSubcommand() throws IOException {
        Path monolithic = tempDir.resolve("type_id.json");
        Files.writeString(monolithic, "{\"3\":[1,2]}");
        Path outputDirectory = tempDir.resolve("out");

        assertEquals(0, run("shard", "--index", monolithic.toString(), "--out", outputDirectory.toString(), "--two-level"));
        assertEquals("[1,2]", Files.readString(outputDirectory.resolve("03").resolve("3.json")));
        assertTrue(Files.exists(outputDirectory.resolve("_meta.json")));
    }

    @Test
    void testParseRecordAcceptsDigitStrings() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        RowRecord record = MainCommand.PackSubcommand.parseRecord(mapper.readTree(
            "{\"date_int\":86400,\"loc_id\":\"7\",\"type_id\":3,\"comp_name\":55,\"ad_id\":9001,\"ad_link\":\" 12 \"}"), 1);

        assertEquals(new RowRecord(86_400, 7, 3, 55, 9001, 12), record);
        assertThrows(IOException.class, () -> MainCommand.PackSubcommand.parseRecord(
            mapper.readTree("{\"date_int\":1,\"loc_id\":1,\"type_id\":1,\"comp_name\":1,\"ad_id\":1}"), 2));
        assertThrows(IOException.class, () -> MainCommand.PackSubcommand.parseRecord(
            mapper.readTree("{\"date_int\":1,\"loc_id\":1,\"type_id\":1,\"comp_name\":1,\"ad_id\":1,\"ad_link\":\"x\"}"), 3));
    }

    @Test
    void testSearchSubcommandPrintTextResultWhenNoHits() throws Exception {
        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        SearchResult emptyResult = new SearchResult(List.of(), 0, 2L, null);
        Method printTextResultMethod = MainCommand.SearchSubcommand.class.getDeclaredMethod("printTextResult", SearchResult.class);
        printTextResultMethod.setAccessible(true);

        String output = captureOutput(() -> printTextResultMethod.invoke(searchSubcommand, emptyResult));

        assertTrue(output.contains("未找到匹配结果"));
    }

    @Test
    void testFormatRecord() {
        String line = MainCommand.formatRecord(4, new RowRecord(86_400, 1, 2, 3, 4, 5));
        assertEquals("#4  日期=1960-01-02  地点=1  类型=2  公司=3  公告=4  链接=5", line);
    }

    private static int run(String... args) {
        return new CommandLine(new MainCommand()).execute(args);
    }

    private static String captureOutput(Callable<?> action) throws Exception {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            action.call();
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }
}
