package com.cfgwrite.write;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 不可变的扁平 token 列表。
 */
public final class Tokens implements TokenGen, Iterable<Token> {
    public static final Tokens EMPTY = new Tokens(List.of());

    private final List<Token> tokens;

    public Tokens(List<Token> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("token 列表不能为空");
        }
        for (Token token : tokens) {
            if (token == null) {
                throw new IllegalArgumentException("token 不能为空");
            }
        }
        this.tokens = List.copyOf(tokens);
    }

    public static Tokens of(Token... tokens) {
        return new Tokens(Arrays.asList(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * 返回 [from, to) 区间的子列表。
     */
    public Tokens slice(int from, int to) {
        return new Tokens(tokens.subList(from, to));
    }

    public List<Token> asList() {
        return tokens;
    }

    public Stream<Token> stream() {
        return tokens.stream();
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    @Override
    public void eachToken(TokenCallback callback) {
        for (Token token : tokens) {
            callback.accept(token);
        }
    }

    @Override
    public Tokens tokens() {
        return this;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Tokens that && tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "Tokens" + tokens;
    }
}
