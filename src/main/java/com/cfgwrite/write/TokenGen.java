package com.cfgwrite.write;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 能按文档顺序产出 token 的节点，是可编辑文档树的底层结构。
 *
 * <p>三种实现：单个 {@link Token}、扁平列表 {@link Tokens}、
 * 以及由子节点组成的 {@link TokenSeq}。遍历不修改树本身。
 */
public sealed interface TokenGen permits Token, Tokens, TokenSeq {

    /**
     * 按展平后的文档顺序，对每个 token 恰好调用一次回调。
     */
    void eachToken(TokenCallback callback);

    /**
     * 将展平结果物化为扁平 token 列表快照。
     */
    default Tokens tokens() {
        List<Token> collected = new ArrayList<>();
        eachToken(collected::add);
        return new Tokens(collected);
    }

    /**
     * 将全部 token 及其前导空格写入目标。
     *
     * @return 写出的总字节数
     * @throws TokenWriteException 目标写入失败时抛出，携带已写出的字节数
     */
    default long writeTo(ByteSink sink) throws TokenWriteException {
        return new TokenWriter(sink).write(this);
    }

    default long writeTo(OutputStream out) throws TokenWriteException {
        return writeTo(ByteSink.of(out));
    }

    /**
     * 序列化为字节数组。
     */
    default byte[] toBytes() {
        ByteSink.Buffer buffer = new ByteSink.Buffer();
        try {
            writeTo(buffer);
        } catch (IOException exception) {
            throw new IllegalStateException("内存缓冲写入失败", exception);
        }
        return buffer.toByteArray();
    }
}
