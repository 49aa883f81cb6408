package com.cfgwrite.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cfgwrite.config.Constants;
import com.cfgwrite.config.WriteConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
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

    private final ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private String output() {
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path writeConfig(String content) throws Exception {
        Path file = tempDir.resolve("app.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, new CommandLine(new MainCommand()).execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--space-chunk", "16", "tokens", "x.conf");

        assertEquals("tokens", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testRoundTripSucceeds() throws Exception {
        String content = "a   = 1 # note\n\tb = [\n  2,\n]\n   ";
        Path file = writeConfig(content);
        Path copy = tempDir.resolve("copy.conf");

        int exitCode = new CommandLine(new MainCommand())
                .execute("--space-chunk", "2", "roundtrip", file.toString(), "--output", copy.toString());

        assertEquals(0, exitCode);
        assertEquals(content, Files.readString(copy, StandardCharsets.UTF_8));
        assertTrue(output().contains("一致"));
    }

    @Test
    void testRoundTripMissingFileFails() {
        int exitCode = new CommandLine(new MainCommand())
                .execute("roundtrip", tempDir.resolve("missing.conf").toString());

        assertEquals(1, exitCode);
    }

    @Test
    void testTokensJsonOutput() throws Exception {
        Path file = writeConfig("key = \"v\"\n");

        int exitCode = new CommandLine(new MainCommand()).execute("tokens", file.toString(), "-f", "json");

        assertEquals(0, exitCode);
        JsonNode tokens = new ObjectMapper().readTree(output());
        assertEquals(5, tokens.size());
        assertEquals("IDENT", tokens.get(0).get("type").asText());
        assertEquals(1, tokens.get(1).get("spacesBefore").asInt());
        assertEquals("\"v\"", tokens.get(2).get("text").asText());
    }

    @Test
    void testTokensTextOutput() throws Exception {
        Path file = writeConfig("key = 1\n");

        int exitCode = new CommandLine(new MainCommand()).execute("--preview", "1", "tokens", file.toString());

        assertEquals(0, exitCode);
        assertTrue(output().contains("NUMBER_LIT"));
        assertTrue(output().contains("共 5 个 token"));
    }

    @Test
    void testSetPrintsEditedDocument() throws Exception {
        Path file = writeConfig("port =  80 # keep\nname = \"x\"\n");

        int exitCode = new CommandLine(new MainCommand()).execute("set", file.toString(), "port", "8080");

        assertEquals(0, exitCode);
        assertEquals("port =  8080 # keep\nname = \"x\"\n", output());
        assertEquals("port =  80 # keep\nname = \"x\"\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testSetInPlace() throws Exception {
        Path file = writeConfig("port = 80\n");

        int exitCode = new CommandLine(new MainCommand())
                .execute("set", "--in-place", file.toString(), "timeout", "30");

        assertEquals(0, exitCode);
        assertEquals("port = 80\ntimeout = 30\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testSetRejectsEmptyValue() throws Exception {
        Path file = writeConfig("port = 80\n");

        assertEquals(1, new CommandLine(new MainCommand()).execute("set", file.toString(), "port", "  "));
    }

    @Test
    void testDefaultsFollowConstants() {
        MainCommand command = new MainCommand();
        new CommandLine(command).parseArgs();

        WriteConfig config = command.resolveConfig();
        assertEquals(Constants.SPACE_CHUNK_SIZE, config.getSpaceChunkSize());
        assertEquals(Constants.TOKEN_PREVIEW_CHARS, config.getTokenPreviewChars());
    }

    @Test
    void testInvalidSpaceChunkFallsBack() {
        MainCommand command = new MainCommand();
        new CommandLine(command).parseArgs("--space-chunk", "0");

        assertEquals(40, command.resolveConfig().getSpaceChunkSize());
    }

    @Test
    void testNoVerifyOption() {
        MainCommand command = new MainCommand();
        new CommandLine(command).parseArgs("--no-verify");

        assertFalse(command.resolveConfig().isVerifyRoundTrip());
        assertTrue(new MainCommand().resolveConfig().isVerifyRoundTrip());
    }

    @Test
    void testFirstDifference() {
        byte[] base = "abc".getBytes(StandardCharsets.UTF_8);

        assertEquals(-1, MainCommand.firstDifference(base, "abc".getBytes(StandardCharsets.UTF_8)));
        assertEquals(1, MainCommand.firstDifference(base, "axc".getBytes(StandardCharsets.UTF_8)));
        assertEquals(3, MainCommand.firstDifference(base, "abcd".getBytes(StandardCharsets.UTF_8)));
    }
}
