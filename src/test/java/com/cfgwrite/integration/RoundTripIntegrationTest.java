package com.cfgwrite.integration;

import com.cfgwrite.edit.AttributeEditor;
import com.cfgwrite.syntax.ConfigLexer;
import com.cfgwrite.syntax.TokenType;
import com.cfgwrite.transform.Attribute;
import com.cfgwrite.transform.AttributesBody;
import com.cfgwrite.transform.Body;
import com.cfgwrite.transform.Transformer;
import com.cfgwrite.transform.Transformers;
import com.cfgwrite.write.Token;
import com.cfgwrite.write.TokenSeq;
import com.cfgwrite.write.Tokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 切分、编辑、变换与序列化的端到端测试
 */
class RoundTripIntegrationTest {

    @TempDir
    Path tempDir;

    private final ConfigLexer lexer = new ConfigLexer();
    private final AttributeEditor editor = new AttributeEditor();

    private static String fixture(String name) throws IOException {
        try (InputStream in = RoundTripIntegrationTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private Tokens value(String expression) {
        Tokens tokens = lexer.tokenize(expression.getBytes(StandardCharsets.UTF_8));
        return tokens.slice(0, tokens.size() - 1);
    }

    @Test
    @DisplayName("未编辑的文件写入磁盘后与原文逐字节相同")
    void testUneditedFileRoundTrip() throws IOException {
        byte[] source = fixture("service.conf").getBytes(StandardCharsets.UTF_8);
        TokenSeq tree = lexer.tokenizeLines(source);
        Path output = tempDir.resolve("out.conf");

        long written;
        try (OutputStream out = Files.newOutputStream(output)) {
            written = tree.writeTo(out);
        }

        assertEquals(source.length, written);
        assertArrayEquals(source, Files.readAllBytes(output));
    }

    @Test
    @DisplayName("多处编辑只改变被编辑的区域")
    void testEditsAreLocal() throws IOException {
        String source = fixture("service.conf");
        TokenSeq tree = lexer.tokenizeLines(source.getBytes(StandardCharsets.UTF_8));

        editor.setAttribute(tree, "name", value("\"edge-gateway\""));
        editor.setAttribute(tree, "upstreams", value("[\"10.0.0.9:9000\"]"));
        editor.removeAttribute(tree, "enabled");
        editor.setAttribute(tree, "added", value("1"));

        String expected = source
                .replace("name    = \"api-gateway\"", "name    = \"edge-gateway\"")
                .replace("upstreams = [\n  \"10.0.0.1:9000\",\n  \"10.0.0.2:9000\",\n]\n",
                        "upstreams = [\"10.0.0.9:9000\"]\n")
                .replace("enabled = true\n", "")
                + "added = 1\n";
        assertEquals(expected, new String(tree.toBytes(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("CRLF 文件编辑后保留原换行风格")
    void testCrlfPreserved() throws IOException {
        String source = fixture("crlf.conf");
        TokenSeq tree = lexer.tokenizeLines(source.getBytes(StandardCharsets.UTF_8));

        editor.setAttribute(tree, "b", value("\"three\""));

        assertEquals("a = 1\r\nb = \"three\"\r\n  c   =   3", new String(tree.toBytes(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("变换链生成的 body 渲染为 token 树")
    void testTransformedBodyRenders() {
        Body input = AttributesBody.of(new Attribute("port", value("80")));
        Transformer pipeline = Transformer.chain(
                Transformers.setAttribute("port", value("8080")),
                Transformers.setAttribute("hosts", value("[\"a\", \"b\"]")),
                Transformers.requireAttribute("port"));

        Body output = pipeline.transformBody(input);

        assertFalse(output.justAttributes().hasErrors());
        TokenSeq rendered = AttributesBody.of(output.justAttributes().attributes()).toTokenSeq();
        assertEquals("port = 8080\nhosts = [\"a\", \"b\"]\n", new String(rendered.toBytes(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("编辑后的树在子树中嵌入新生成的 token 仍可正确序列化")
    void testGeneratedSubtreeInsideParsedTree() {
        TokenSeq tree = lexer.tokenizeLines("a = 1\n".getBytes(StandardCharsets.UTF_8));
        TokenSeq generated = TokenSeq.of(
                Tokens.of(Token.of(TokenType.COMMENT, "# generated")),
                Tokens.of(Token.of(TokenType.NEWLINE, "\n")));

        tree.add(0, generated);

        assertEquals("# generated\na = 1\n", new String(tree.toBytes(), StandardCharsets.UTF_8));
    }
}
