package com.cfgwrite.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.cfgwrite.config.Constants;
import com.cfgwrite.config.WriteConfig;
import com.cfgwrite.edit.AttributeEditor;
import com.cfgwrite.syntax.ConfigLexer;
import com.cfgwrite.write.ByteSink;
import com.cfgwrite.write.Token;
import com.cfgwrite.write.TokenSeq;
import com.cfgwrite.write.TokenWriter;
import com.cfgwrite.write.Tokens;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "cfgwrite",
    description = "保留排版的配置文件重写工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.RoundTripSubcommand.class,
        MainCommand.TokensSubcommand.class,
        MainCommand.SetSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--space-chunk"}, description = "前导空格写出块大小", defaultValue = "" + Constants.SPACE_CHUNK_SIZE)
    private int spaceChunk;

    @Option(names = {"--preview"}, description = "token 文本预览字符数", defaultValue = "" + Constants.TOKEN_PREVIEW_CHARS)
    private int preview;

    @Option(names = {"--no-verify"}, description = "编辑前不校验原文件能否逐字节复现")
    private boolean noVerify;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("保留排版的配置文件重写工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 由全局选项构建运行时配置，非法值回退为默认值。
     */
    WriteConfig resolveConfig() {
        WriteConfig config = WriteConfig.defaults();
        if (spaceChunk <= 0 || spaceChunk > Constants.MAX_SPACE_CHUNK_SIZE) {
            System.err.printf("非法块大小 %d，已回退为默认值 %d%n", spaceChunk, Constants.SPACE_CHUNK_SIZE);
        } else {
            config.setSpaceChunkSize(spaceChunk);
        }
        if (preview < 0) {
            System.err.printf("非法预览长度 %d，已回退为默认值 %d%n", preview, Constants.TOKEN_PREVIEW_CHARS);
        } else {
            config.setTokenPreviewChars(preview);
        }
        config.setVerifyRoundTrip(!noVerify);
        return config;
    }

    static byte[] readSource(Path file) throws IOException {
        long size = Files.size(file);
        if (size > Constants.MAX_INPUT_BYTES) {
            throw new IOException("文件超过大小限制（最大 " + Constants.MAX_INPUT_BYTES + " 字节）: " + file);
        }
        return Files.readAllBytes(file);
    }

    static byte[] serialize(TokenSeq tree, WriteConfig config) throws IOException {
        ByteSink.Buffer buffer = new ByteSink.Buffer();
        new TokenWriter(buffer, config).write(tree);
        return buffer.toByteArray();
    }

    /**
     * 返回两个字节数组第一个不同的位置，相同时返回 -1。
     */
    static int firstDifference(byte[] expected, byte[] actual) {
        int limit = Math.min(expected.length, actual.length);
        for (int index = 0; index < limit; index++) {
            if (expected[index] != actual[index]) {
                return index;
            }
        }
        return expected.length == actual.length ? -1 : limit;
    }

    @Command(name = "roundtrip", description = "切分并重新序列化文件，校验字节一致")
    static class RoundTripSubcommand implements Callable<Integer> {

        @Parameters(description = "配置文件路径", arity = "1")
        private Path file;

        @Option(names = {"-o", "--output"}, description = "将序列化结果写入该文件")
        private Path output;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                WriteConfig config = main.resolveConfig();
                byte[] source = readSource(file);
                TokenSeq tree = new ConfigLexer().tokenizeLines(source);

                if (output != null) {
                    try (OutputStream out = Files.newOutputStream(output)) {
                        long written = new TokenWriter(ByteSink.of(out), config).write(tree);
                        System.out.println("已写出: " + output + " (" + written + " 字节)");
                    }
                }

                byte[] result = serialize(tree, config);
                int diff = firstDifference(source, result);
                if (diff >= 0) {
                    System.err.println("字节不一致，首个差异位置: " + diff);
                    return 1;
                }
                System.out.println("一致: " + file + " (" + result.length + " 字节, " + tree.size() + " 行)");
                return 0;
            } catch (Exception exception) {
                System.err.println("校验失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "tokens", description = "输出文件的 token 序列")
    static class TokensSubcommand implements Callable<Integer> {

        @Parameters(description = "配置文件路径", arity = "1")
        private Path file;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        /** JSON 输出使用的 token 视图 */
        record TokenView(String type, int spacesBefore, String text) {
        }

        @Override
        public Integer call() {
            try {
                WriteConfig config = main.resolveConfig();
                Tokens tokens = new ConfigLexer().tokenize(readSource(file));
                if ("json".equalsIgnoreCase(format)) {
                    printJson(tokens);
                } else {
                    printText(tokens, config.getTokenPreviewChars());
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("读取失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printText(Tokens tokens, int previewChars) {
            int index = 0;
            for (Token token : tokens) {
                System.out.printf("%5d  %-16s %4d  %s%n", index++, token.type(), token.spacesBefore(),
                        preview(token.text(), previewChars));
            }
            System.out.println("共 " + tokens.size() + " 个 token");
        }

        private void printJson(Tokens tokens) throws IOException {
            List<TokenView> views = new ArrayList<>(tokens.size());
            for (Token token : tokens) {
                views.add(new TokenView(token.type().name(), token.spacesBefore(), token.text()));
            }
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(views));
        }

        private String preview(String text, int maxChars) {
            String escaped = text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
            if (escaped.length() <= maxChars) {
                return escaped;
            }
            return escaped.substring(0, maxChars) + "...";
        }
    }

    @Command(name = "set", description = "设置顶层属性值，保留其余内容的排版")
    static class SetSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "配置文件路径")
        private Path file;

        @Parameters(index = "1", description = "属性名")
        private String name;

        @Parameters(index = "2", description = "属性值表达式")
        private String value;

        @Option(names = {"-i", "--in-place"}, description = "直接写回原文件")
        private boolean inPlace;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                WriteConfig config = main.resolveConfig();
                ConfigLexer lexer = new ConfigLexer();
                byte[] source = readSource(file);
                TokenSeq lines = lexer.tokenizeLines(source);
                if (config.isVerifyRoundTrip() && firstDifference(source, serialize(lines, config)) >= 0) {
                    System.err.println("原文件无法逐字节复现，已放弃编辑: " + file);
                    return 1;
                }
                Tokens valueTokens = valueTokens(lexer, value);
                if (valueTokens.isEmpty()) {
                    System.err.println("属性值不能为空");
                    return 1;
                }

                boolean replaced = new AttributeEditor().setAttribute(lines, name, valueTokens);
                byte[] result = serialize(lines, config);
                if (inPlace) {
                    Files.write(file, result);
                    System.out.println((replaced ? "已替换: " : "已追加: ") + name + " -> " + file);
                } else {
                    System.out.print(new String(result, StandardCharsets.UTF_8));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("编辑失败: " + exception.getMessage());
                return 1;
            }
        }

        /**
         * 切分值表达式，去掉结尾的换行与 EOF token。
         */
        private Tokens valueTokens(ConfigLexer lexer, String expression) {
            Tokens tokens = lexer.tokenize(expression.strip().getBytes(StandardCharsets.UTF_8));
            List<Token> significant = new ArrayList<>(tokens.asList());
            significant.removeIf(token -> switch (token.type()) {
                case EOF, NEWLINE -> true;
                default -> false;
            });
            return new Tokens(significant);
        }
    }
}
