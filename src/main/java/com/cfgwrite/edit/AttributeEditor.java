package com.cfgwrite.edit;

import com.cfgwrite.syntax.TokenType;
import com.cfgwrite.transform.AttributesBody;
import com.cfgwrite.write.Token;
import com.cfgwrite.write.TokenSeq;
import com.cfgwrite.write.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 在按行分组的 token 树上编辑顶层属性。
 *
 * <p>只替换目标属性所在行的子树，其余行的 token 原样保留，序列化后字节不变。
 * 属性值跨多行时（括号未闭合），后续行一并视为该属性的一部分。
 */
public class AttributeEditor {
    private static final Logger logger = LoggerFactory.getLogger(AttributeEditor.class);

    /** 属性所占的行区间 [start, end] */
    private record Span(int start, int end) {
    }

    /**
     * 设置属性值。属性存在时替换其值并保留名称、等号及行尾注释的原排版；
     * 不存在时以规范风格追加到文件末尾。
     *
     * @return 替换了已有属性时返回 true，追加新属性时返回 false
     */
    public boolean setAttribute(TokenSeq lines, String name, Tokens value) {
        validate(lines, name);
        if (value == null) {
            throw new IllegalArgumentException("属性值不能为空: " + name);
        }

        Optional<Span> span = findSpan(lines, name);
        if (span.isEmpty()) {
            appendLine(lines, AttributesBody.renderLine(name, value));
            logger.debug("追加属性: {}", name);
            return false;
        }

        Span found = span.get();
        Tokens first = lines.get(found.start()).tokens();
        Tokens last = lines.get(found.end()).tokens();
        int equalIndex = indexOfEqual(first);

        List<Token> replacement = new ArrayList<>(first.slice(0, equalIndex + 1).asList());
        int valueSpaces = equalIndex + 1 < first.size() && !isLineEnd(first.get(equalIndex + 1))
                ? first.get(equalIndex + 1).spacesBefore()
                : 1;
        for (int index = 0; index < value.size(); index++) {
            Token token = value.get(index);
            replacement.add(index == 0 ? token.withSpacesBefore(valueSpaces) : token);
        }
        replacement.addAll(lineTrailer(last).asList());

        lines.set(found.start(), new Tokens(replacement));
        for (int index = found.start() + 1; index <= found.end(); index++) {
            lines.set(index, TokenSeq.EMPTY);
        }
        logger.debug("替换属性: {} (行 {}-{})", name, found.start(), found.end());
        return true;
    }

    /**
     * 删除属性所占的全部行；文件结束 token 保留。
     *
     * @return 属性存在并被删除时返回 true
     */
    public boolean removeAttribute(TokenSeq lines, String name) {
        validate(lines, name);
        Optional<Span> span = findSpan(lines, name);
        if (span.isEmpty()) {
            return false;
        }
        Span found = span.get();
        for (int index = found.start(); index <= found.end(); index++) {
            Tokens line = lines.get(index).tokens();
            Token terminator = line.isEmpty() ? null : line.get(line.size() - 1);
            if (terminator != null && terminator.type() == TokenType.EOF) {
                lines.set(index, Tokens.of(terminator));
            } else {
                lines.set(index, TokenSeq.EMPTY);
            }
        }
        logger.debug("删除属性: {} (行 {}-{})", name, found.start(), found.end());
        return true;
    }

    /**
     * 读取属性值 token（不含等号、行尾注释与换行）。
     */
    public Optional<Tokens> valueOf(TokenSeq lines, String name) {
        validate(lines, name);
        return findSpan(lines, name).map(span -> {
            List<Token> value = new ArrayList<>();
            for (int index = span.start(); index <= span.end(); index++) {
                Tokens line = lines.get(index).tokens();
                int from = index == span.start() ? indexOfEqual(line) + 1 : 0;
                int to = index == span.end() ? line.size() - lineTrailer(line).size() : line.size();
                value.addAll(line.slice(from, Math.max(from, to)).asList());
            }
            return new Tokens(value);
        });
    }

    /**
     * 查找顶层属性所在的行区间，只匹配括号嵌套深度为 0 的行。
     */
    private Optional<Span> findSpan(TokenSeq lines, String name) {
        int depth = 0;
        for (int index = 0; index < lines.size(); index++) {
            Tokens line = lines.get(index).tokens();
            if (depth == 0 && isAttributeLine(line, name)) {
                int end = index;
                int valueDepth = nestingDelta(line);
                while (valueDepth > 0 && end + 1 < lines.size()) {
                    end++;
                    valueDepth += nestingDelta(lines.get(end).tokens());
                }
                return Optional.of(new Span(index, end));
            }
            depth = Math.max(0, depth + nestingDelta(line));
        }
        return Optional.empty();
    }

    private boolean isAttributeLine(Tokens line, String name) {
        int index = skipTabs(line, 0);
        if (index >= line.size()) {
            return false;
        }
        Token first = line.get(index);
        if (first.type() != TokenType.IDENT || !first.text().equals(name)) {
            return false;
        }
        index = skipTabs(line, index + 1);
        return index < line.size() && line.get(index).type() == TokenType.EQUAL;
    }

    private int indexOfEqual(Tokens line) {
        for (int index = 0; index < line.size(); index++) {
            if (line.get(index).type() == TokenType.EQUAL) {
                return index;
            }
        }
        throw new IllegalStateException("属性行缺少等号");
    }

    private int skipTabs(Tokens line, int from) {
        int index = from;
        while (index < line.size() && line.get(index).type() == TokenType.TABS) {
            index++;
        }
        return index;
    }

    private int nestingDelta(Tokens line) {
        int delta = 0;
        for (Token token : line) {
            switch (token.type()) {
                case OBRACE, OBRACK, OPAREN -> delta++;
                case CBRACE, CBRACK, CPAREN -> delta--;
                default -> {
                }
            }
        }
        return delta;
    }

    /**
     * 行尾部分：可选的行尾注释加上换行或文件结束 token。
     */
    private Tokens lineTrailer(Tokens line) {
        int from = line.size();
        while (from > 0 && isLineEnd(line.get(from - 1))) {
            from--;
        }
        if (from > 0 && line.get(from - 1).type() == TokenType.COMMENT) {
            from--;
        }
        return line.slice(from, line.size());
    }

    private boolean isLineEnd(Token token) {
        return token.type() == TokenType.NEWLINE || token.type() == TokenType.EOF;
    }

    /**
     * 追加新行；最后一行只有文件结束 token 时插入在其之前，否则先补一个换行。
     */
    private void appendLine(TokenSeq lines, Tokens line) {
        if (lines.isEmpty()) {
            lines.add(line);
            return;
        }
        Tokens last = lines.get(lines.size() - 1).tokens();
        boolean onlyEof = last.size() == 1 && last.get(0).type() == TokenType.EOF;
        boolean endsWithNewline = !last.isEmpty() && last.get(last.size() - 1).type() == TokenType.NEWLINE;
        if (onlyEof) {
            lines.add(lines.size() - 1, line);
        } else if (endsWithNewline || last.isEmpty()) {
            lines.add(line);
        } else {
            lines.add(Tokens.of(Token.of(TokenType.NEWLINE, "\n")));
            lines.add(line);
        }
    }

    private void validate(TokenSeq lines, String name) {
        if (lines == null) {
            throw new IllegalArgumentException("token 树不能为空");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("属性名不能为空");
        }
    }
}
