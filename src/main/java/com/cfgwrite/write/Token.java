package com.cfgwrite.write;

import com.cfgwrite.syntax.TokenType;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 带分类标签的字节片段，并记录其前方的空格数。
 *
 * <p>前导空格只统计 ASCII 空格；制表符、换行与注释都是独立 token。
 * 保留原文件中的空格数，才能在局部修改时原样复现未改动区域的排版。
 */
public final class Token implements TokenGen {
    private final TokenType type;
    private final byte[] bytes;
    private final int spacesBefore;

    public Token(TokenType type, byte[] bytes, int spacesBefore) {
        if (type == null) {
            throw new IllegalArgumentException("token 类型不能为空");
        }
        if (bytes == null) {
            throw new IllegalArgumentException("token 字节不能为空");
        }
        if (spacesBefore < 0) {
            throw new IllegalArgumentException("spacesBefore 不能为负数: " + spacesBefore);
        }
        this.type = type;
        this.bytes = bytes.clone();
        this.spacesBefore = spacesBefore;
    }

    public Token(TokenType type, byte[] bytes) {
        this(type, bytes, 0);
    }

    /**
     * 以 UTF-8 编码文本创建 token。
     */
    public static Token of(TokenType type, String text, int spacesBefore) {
        if (text == null) {
            throw new IllegalArgumentException("token 文本不能为空");
        }
        return new Token(type, text.getBytes(StandardCharsets.UTF_8), spacesBefore);
    }

    public static Token of(TokenType type, String text) {
        return of(type, text, 0);
    }

    public TokenType type() {
        return type;
    }

    /**
     * 返回字节内容的副本。
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int spacesBefore() {
        return spacesBefore;
    }

    public int length() {
        return bytes.length;
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 返回仅前导空格数不同的新 token。
     */
    public Token withSpacesBefore(int spaces) {
        if (spaces == spacesBefore) {
            return this;
        }
        return new Token(type, bytes, spaces);
    }

    // 供写出器直接使用，调用方不得修改
    byte[] rawBytes() {
        return bytes;
    }

    @Override
    public void eachToken(TokenCallback callback) {
        callback.accept(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Token token)) {
            return false;
        }
        return spacesBefore == token.spacesBefore
                && type == token.type
                && Arrays.equals(bytes, token.bytes);
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + Arrays.hashCode(bytes);
        result = 31 * result + spacesBefore;
        return result;
    }

    @Override
    public String toString() {
        return "Token[" + type + ", " + spacesBefore + ", \"" + text() + "\"]";
    }
}
