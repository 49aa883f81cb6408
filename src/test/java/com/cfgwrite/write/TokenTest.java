package com.cfgwrite.write;

import com.cfgwrite.syntax.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TokenTest {

    @Test
    @DisplayName("字节内容在构造与读取时都做拷贝")
    void testBytesAreCopied() {
        byte[] source = "name".getBytes(StandardCharsets.UTF_8);
        Token token = new Token(TokenType.IDENT, source, 2);

        source[0] = 'X';
        assertEquals("name", token.text());

        byte[] exposed = token.bytes();
        exposed[0] = 'Y';
        assertEquals("name", token.text());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Token(TokenType.IDENT, new byte[0], -1));
        assertThrows(IllegalArgumentException.class, () -> new Token(null, new byte[0], 0));
        assertThrows(IllegalArgumentException.class, () -> new Token(TokenType.IDENT, null, 0));
        assertThrows(IllegalArgumentException.class, () -> Token.of(TokenType.IDENT, null));
    }

    @Test
    void testValueEquality() {
        Token first = Token.of(TokenType.NUMBER_LIT, "42", 1);
        Token second = Token.of(TokenType.NUMBER_LIT, "42", 1);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, Token.of(TokenType.NUMBER_LIT, "42", 2));
        assertNotEquals(first, Token.of(TokenType.IDENT, "42", 1));
    }

    @Test
    void testWithSpacesBefore() {
        Token token = Token.of(TokenType.EQUAL, "=");

        assertSame(token, token.withSpacesBefore(0));
        Token shifted = token.withSpacesBefore(3);
        assertEquals(3, shifted.spacesBefore());
        assertEquals(0, token.spacesBefore());
        assertEquals("=", shifted.text());
    }

    @Test
    @DisplayName("单个 token 展平后只产出自身")
    void testSingleTokenFlattensToItself() {
        Token token = Token.of(TokenType.IDENT, "x");

        assertEquals(Tokens.of(token), token.tokens());
        assertArrayEquals("x".getBytes(StandardCharsets.UTF_8), token.toBytes());
    }
}
