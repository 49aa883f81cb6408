package com.cfgwrite;

import com.cfgwrite.syntax.ConfigLexer;
import com.cfgwrite.write.ByteSink;
import com.cfgwrite.write.TokenSeq;
import com.cfgwrite.write.TokenWriteException;
import com.cfgwrite.write.TokenWriter;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * 序列化性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class WriterBenchmark {

    @State(Scope.Thread)
    public static class TreeState {
        @Param({"4", "200"})
        int indent;

        byte[] source;
        TokenSeq tree;

        @Setup
        public void setup() {
            source = generateDocument(2000, indent).getBytes(StandardCharsets.UTF_8);
            tree = new ConfigLexer().tokenizeLines(source);
        }

        private String generateDocument(int attributes, int indentWidth) {
            StringBuilder builder = new StringBuilder("block \"bench\" {\n");
            String padding = " ".repeat(indentWidth);
            for (int i = 0; i < attributes; i++) {
                builder.append(padding).append("attr_").append(i).append(" = \"value ")
                        .append(i).append("\" # comment\n");
            }
            return builder.append("}\n").toString();
        }
    }

    @Benchmark
    public long benchmarkWrite(TreeState state) throws TokenWriteException {
        ByteSink.Buffer buffer = new ByteSink.Buffer();
        return new TokenWriter(buffer).write(state.tree);
    }

    @Benchmark
    public int benchmarkTokenize(TreeState state) {
        return new ConfigLexer().tokenize(state.source).size();
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(WriterBenchmark.class.getSimpleName())
                .build();
        new Runner(options).run();
    }
}
