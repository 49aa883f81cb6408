package com.cfgwrite.write;

/**
 * 展平遍历时对每个 token 执行的动作。
 */
@FunctionalInterface
public interface TokenCallback {

    void accept(Token token);
}
