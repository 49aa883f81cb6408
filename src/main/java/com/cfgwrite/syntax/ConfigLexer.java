package com.cfgwrite.syntax;

import com.cfgwrite.write.Token;
import com.cfgwrite.write.TokenSeq;
import com.cfgwrite.write.Tokens;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 配置文件的字节级参考词法器。
 *
 * <p>每个输入字节恰好归入一个 token，ASCII 空格折叠为下一个 token 的前导空格数，
 * 末尾追加一个空内容的 EOF token 承载尾随空格，因此序列化结果与输入逐字节相同。
 * 无法识别的内容产出 INVALID token，而不是抛出异常。
 */
public class ConfigLexer {
    private static final String[] MULTI_BYTE_OPERATORS = {"...", "&&", "||", "==", "!=", "<=", ">=", "=>"};

    /**
     * 将源字节切分为扁平 token 序列。
     */
    public Tokens tokenize(byte[] src) {
        if (src == null) {
            throw new IllegalArgumentException("源字节不能为空");
        }

        List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (true) {
            int spaces = 0;
            while (index < src.length && src[index] == ' ') {
                spaces++;
                index++;
            }
            if (index >= src.length) {
                tokens.add(new Token(TokenType.EOF, new byte[0], spaces));
                break;
            }

            int end = scanToken(src, index);
            tokens.add(new Token(classify(src, index, end), slice(src, index, end), spaces));
            index = end;
        }
        return new Tokens(tokens);
    }

    /**
     * 切分后按行分组：每行一个 {@link Tokens} 子节点，换行 token 归入所在行。
     */
    public TokenSeq tokenizeLines(byte[] src) {
        Tokens tokens = tokenize(src);
        TokenSeq lines = new TokenSeq();
        int lineStart = 0;
        for (int index = 0; index < tokens.size(); index++) {
            TokenType type = tokens.get(index).type();
            if (type == TokenType.NEWLINE || type == TokenType.EOF) {
                lines.add(tokens.slice(lineStart, index + 1));
                lineStart = index + 1;
            }
        }
        return lines;
    }

    /**
     * 从 start 开始扫描一个 token，返回其结束位置（不含）。
     */
    private int scanToken(byte[] src, int start) {
        byte current = src[start];

        if (current == '\n') {
            return start + 1;
        }
        if (current == '\r') {
            return start + 1 < src.length && src[start + 1] == '\n' ? start + 2 : start + 1;
        }
        if (current == '\t') {
            int index = start;
            while (index < src.length && src[index] == '\t') {
                index++;
            }
            return index;
        }
        if (current == '#' || startsWith(src, start, "//")) {
            return scanLineComment(src, start);
        }
        if (startsWith(src, start, "/*")) {
            int close = indexOf(src, start + 2, "*/");
            return close < 0 ? src.length : close + 2;
        }
        if (current == '"') {
            return scanQuoted(src, start);
        }
        if (isDigit(current)) {
            return scanNumber(src, start);
        }
        if (isIdentStart(current)) {
            int index = start + 1;
            while (index < src.length && isIdentPart(src[index])) {
                index++;
            }
            return index;
        }

        for (String operator : MULTI_BYTE_OPERATORS) {
            if (startsWith(src, start, operator)) {
                return start + operator.length();
            }
        }
        if (isUtf8Lead(current)) {
            return scanUtf8Sequence(src, start);
        }
        return start + 1;
    }

    /**
     * 按 token 内容确定分类。
     */
    private TokenType classify(byte[] src, int start, int end) {
        byte current = src[start];
        int length = end - start;

        if (current == '\n' || current == '\r') {
            return length == 2 || current == '\n' ? TokenType.NEWLINE : TokenType.INVALID;
        }
        if (current == '\t') {
            return TokenType.TABS;
        }
        if (current == '#' || startsWith(src, start, "//")) {
            return TokenType.COMMENT;
        }
        if (startsWith(src, start, "/*")) {
            boolean closed = length >= 4 && src[end - 2] == '*' && src[end - 1] == '/';
            return closed ? TokenType.COMMENT : TokenType.INVALID;
        }
        if (current == '"') {
            boolean closed = length >= 2 && src[end - 1] == '"' && !isEscaped(src, start + 1, end - 1);
            return closed ? TokenType.QUOTED_LIT : TokenType.INVALID;
        }
        if (isDigit(current)) {
            return TokenType.NUMBER_LIT;
        }
        if (isIdentStart(current)) {
            return TokenType.IDENT;
        }
        if (length > 1) {
            return operatorType(new String(src, start, length, StandardCharsets.US_ASCII));
        }
        return switch (current) {
            case '{' -> TokenType.OBRACE;
            case '}' -> TokenType.CBRACE;
            case '[' -> TokenType.OBRACK;
            case ']' -> TokenType.CBRACK;
            case '(' -> TokenType.OPAREN;
            case ')' -> TokenType.CPAREN;
            case '=' -> TokenType.EQUAL;
            case ',' -> TokenType.COMMA;
            case '.' -> TokenType.DOT;
            case ':' -> TokenType.COLON;
            case '?' -> TokenType.QUESTION;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '!' -> TokenType.BANG;
            case '<' -> TokenType.LESS_THAN;
            case '>' -> TokenType.GREATER_THAN;
            default -> TokenType.INVALID;
        };
    }

    private TokenType operatorType(String operator) {
        return switch (operator) {
            case "..." -> TokenType.ELLIPSIS;
            case "&&" -> TokenType.AND;
            case "||" -> TokenType.OR;
            case "==" -> TokenType.EQUAL_OP;
            case "!=" -> TokenType.NOT_EQUAL;
            case "<=" -> TokenType.LESS_THAN_EQ;
            case ">=" -> TokenType.GREATER_THAN_EQ;
            case "=>" -> TokenType.FAT_ARROW;
            default -> TokenType.INVALID;
        };
    }

    /**
     * 行注释不包含结尾换行，换行作为独立 token。
     */
    private int scanLineComment(byte[] src, int start) {
        int index = start;
        while (index < src.length && src[index] != '\n' && src[index] != '\r') {
            index++;
        }
        return index;
    }

    /**
     * 读取双引号字符串，支持反斜杠转义；遇到换行或输入结束视为未闭合。
     */
    private int scanQuoted(byte[] src, int start) {
        int index = start + 1;
        while (index < src.length) {
            byte current = src[index];
            if (current == '\\' && index + 1 < src.length && src[index + 1] != '\n' && src[index + 1] != '\r') {
                index += 2;
                continue;
            }
            if (current == '"') {
                return index + 1;
            }
            if (current == '\n' || current == '\r') {
                return index;
            }
            index++;
        }
        return index;
    }

    /**
     * 数字字面量：整数部分、可选小数部分与指数部分。
     */
    private int scanNumber(byte[] src, int start) {
        int index = start;
        while (index < src.length && isDigit(src[index])) {
            index++;
        }
        if (index + 1 < src.length && src[index] == '.' && isDigit(src[index + 1])) {
            index++;
            while (index < src.length && isDigit(src[index])) {
                index++;
            }
        }
        if (index < src.length && (src[index] == 'e' || src[index] == 'E')) {
            int exponent = index + 1;
            if (exponent < src.length && (src[exponent] == '+' || src[exponent] == '-')) {
                exponent++;
            }
            if (exponent < src.length && isDigit(src[exponent])) {
                index = exponent;
                while (index < src.length && isDigit(src[index])) {
                    index++;
                }
            }
        }
        return index;
    }

    /**
     * 非 ASCII 字符整体作为一个 token，避免拆开多字节序列。
     */
    private int scanUtf8Sequence(byte[] src, int start) {
        int index = start + 1;
        while (index < src.length && (src[index] & 0xC0) == 0x80) {
            index++;
        }
        return index;
    }

    /**
     * 判断闭合引号前是否为奇数个反斜杠。
     */
    private boolean isEscaped(byte[] src, int contentStart, int quoteIndex) {
        int backslashes = 0;
        for (int index = quoteIndex - 1; index >= contentStart && src[index] == '\\'; index--) {
            backslashes++;
        }
        return backslashes % 2 != 0;
    }

    private boolean startsWith(byte[] src, int start, String prefix) {
        if (start + prefix.length() > src.length) {
            return false;
        }
        for (int offset = 0; offset < prefix.length(); offset++) {
            if (src[start + offset] != prefix.charAt(offset)) {
                return false;
            }
        }
        return true;
    }

    private int indexOf(byte[] src, int from, String needle) {
        for (int index = from; index + needle.length() <= src.length; index++) {
            if (startsWith(src, index, needle)) {
                return index;
            }
        }
        return -1;
    }

    private byte[] slice(byte[] src, int start, int end) {
        byte[] out = new byte[end - start];
        System.arraycopy(src, start, out, 0, out.length);
        return out;
    }

    private boolean isDigit(byte value) {
        return value >= '0' && value <= '9';
    }

    private boolean isIdentStart(byte value) {
        return (value >= 'a' && value <= 'z') || (value >= 'A' && value <= 'Z') || value == '_';
    }

    private boolean isIdentPart(byte value) {
        return isIdentStart(value) || isDigit(value) || value == '-';
    }

    private boolean isUtf8Lead(byte value) {
        return (value & 0xC0) == 0xC0;
    }
}
