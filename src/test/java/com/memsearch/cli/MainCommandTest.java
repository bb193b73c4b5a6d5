package com.memsearch.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private Path corpusFile;
    private final ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errorBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        corpusFile = tempDir.resolve("corpus.txt");
        Files.writeString(corpusFile, "this is a Test\tfirst\n"
            + "test TEST prØve\tsecond\n"
            + "water is toxic\tthird\n");
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errorBuffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = MainCommand.newCommandLine().execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = MainCommand.newCommandLine();
        ParseResult parseResult = commandLine.parseArgs("--fields", "body,meta", "--threads", "2", "status", "corpus.txt");

        assertNotNull(parseResult.subcommand());
        assertEquals("status", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testSearchTextOutput() {
        int exitCode = execute("search", corpusFile.toString(), "test");

        assertEquals(0, exitCode);
        String outputText = output();
        assertTrue(outputText.contains("doc#1 (score: 2.0)"), outputText);
        assertTrue(outputText.contains("doc#0 (score: 1.0)"), outputText);
        assertTrue(outputText.contains("共 2 条匹配"), outputText);
    }

    @Test
    void testSearchJsonOutput() {
        int exitCode = execute("search", corpusFile.toString(), "water OR prøve", "--format", "json");

        assertEquals(0, exitCode);
        String outputText = output();
        assertTrue(outputText.contains("\"totalMatches\" : 2"), outputText);
        assertTrue(outputText.contains("\"query\""), outputText);
        assertTrue(outputText.contains("\"documentId\""), outputText);
    }

    @Test
    void testSearchWithOrOperator() {
        int exitCode = execute("search", corpusFile.toString(), "water test", "--operator", "OR");

        assertEquals(0, exitCode);
        assertTrue(output().contains("共 3 条匹配"));
    }

    @Test
    void testOperatorOptionIgnoresCase() {
        int exitCode = execute("search", corpusFile.toString(), "water test", "--operator", "or");

        assertEquals(0, exitCode);
        assertTrue(output().contains("共 3 条匹配"));
    }

    @Test
    void testQueryWithoutWordsReturnsTwo() {
        assertEquals(MainCommand.EXIT_QUERY_ERROR, execute("search", corpusFile.toString(), "?!"));
    }

    @Test
    void testSearchWithoutHits() {
        int exitCode = execute("search", corpusFile.toString(), "wtf");

        assertEquals(0, exitCode);
        assertTrue(output().contains("未找到匹配结果"));
    }

    @Test
    void testSearchOnMetaField() {
        int exitCode = execute("--fields", "meta", "search", corpusFile.toString(), "second");

        assertEquals(0, exitCode);
        assertTrue(output().contains("doc#1"));
    }

    @Test
    void testSearchSyntaxErrorReturnsTwo() {
        int exitCode = execute("search", corpusFile.toString(), "(test");

        assertEquals(MainCommand.EXIT_QUERY_ERROR, exitCode);
        assertTrue(errors().contains("查询语法错误"));
    }

    @Test
    void testSearchMissingCorpusReturnsOne() {
        int exitCode = execute("search", tempDir.resolve("missing.txt").toString(), "test");

        assertEquals(1, exitCode);
        assertTrue(errors().contains("搜索失败"));
    }

    @Test
    void testPostingsSubcommand() {
        int exitCode = execute("postings", corpusFile.toString(), "PRøvE wtf tesT");

        assertEquals(0, exitCode);
        String outputText = output();
        assertTrue(outputText.contains("*** prøve (df=1)"), outputText);
        assertTrue(outputText.contains("[(1, 1)]"), outputText);
        assertTrue(outputText.contains("*** wtf (df=0)"), outputText);
        assertTrue(outputText.contains("[(0, 1), (1, 2)]"), outputText);
    }

    @Test
    void testStatusSubcommand() {
        int exitCode = execute("--threads", "0", "status", corpusFile.toString());

        assertEquals(0, exitCode);
        String outputText = output();
        assertTrue(outputText.contains("文档总数: 3"), outputText);
        assertTrue(outputText.contains("词项总数: 7"), outputText);
        assertTrue(errors().contains("非法线程数"));
    }

    @Test
    void testStatusUnsupportedFormatReturnsOne() throws IOException {
        Path csv = tempDir.resolve("corpus.csv");
        Files.writeString(csv, "a,b\n");

        assertEquals(1, execute("status", csv.toString()));
    }

    private int execute(String... args) {
        return MainCommand.newCommandLine().execute(args);
    }

    private String output() {
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return errorBuffer.toString(StandardCharsets.UTF_8);
    }
}
