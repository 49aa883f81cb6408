package com.cfgwrite.write;

import com.cfgwrite.config.Constants;
import com.cfgwrite.config.WriteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;

/**
 * token 树序列化器，逐个写出前导空格与 token 字节。
 *
 * <p>前导空格从一个固定长度的空格缓冲区分块写出，不随空格数分配内存。
 * 目标第一次失败（异常或短写）即停止，不重试、不再访问后续 token。
 */
public final class TokenWriter {
    private static final Logger logger = LoggerFactory.getLogger(TokenWriter.class);

    private final ByteSink sink;
    private final byte[] spaces;

    public TokenWriter(ByteSink sink, int spaceChunkSize) {
        if (sink == null) {
            throw new IllegalArgumentException("输出目标不能为空");
        }
        if (spaceChunkSize <= 0) {
            throw new IllegalArgumentException("spaceChunkSize 必须为正数: " + spaceChunkSize);
        }
        this.sink = sink;
        this.spaces = new byte[spaceChunkSize];
        Arrays.fill(this.spaces, (byte) ' ');
    }

    public TokenWriter(ByteSink sink) {
        this(sink, Constants.SPACE_CHUNK_SIZE);
    }

    public TokenWriter(ByteSink sink, WriteConfig config) {
        this(sink, config.getSpaceChunkSize());
    }

    /**
     * 写出整棵树。
     *
     * @return 写出的总字节数
     * @throws TokenWriteException 目标失败时抛出，携带已写出的字节数
     */
    public long write(TokenGen root) throws TokenWriteException {
        if (root == null) {
            throw new IllegalArgumentException("token 树不能为空");
        }
        WriteState state = new WriteState();
        root.eachToken(token -> {
            if (state.failure == null) {
                writeToken(token, state);
            }
        });
        if (state.failure != null) {
            logger.debug("序列化中止: 已写出 {} 字节, token 数 {}", state.written, state.tokenCount);
            throw state.failure;
        }
        logger.debug("序列化完成: {} 字节, token 数 {}", state.written, state.tokenCount);
        return state.written;
    }

    /**
     * 写出单个 token，失败时记录到 state 并立即返回。
     */
    private void writeToken(Token token, WriteState state) {
        state.tokenCount++;
        for (int remaining = token.spacesBefore(); remaining > 0; remaining -= spaces.length) {
            int chunk = Math.min(remaining, spaces.length);
            if (!writeChunk(spaces, chunk, state)) {
                return;
            }
        }
        byte[] payload = token.rawBytes();
        if (payload.length > 0) {
            writeChunk(payload, payload.length, state);
        }
    }

    private boolean writeChunk(byte[] buf, int len, WriteState state) {
        int accepted;
        try {
            accepted = sink.write(buf, 0, len);
        } catch (IOException exception) {
            state.failure = new TokenWriteException("写入目标失败: " + exception.getMessage(),
                    state.written, exception);
            return false;
        }
        if (accepted < 0 || accepted > len) {
            state.failure = new TokenWriteException("目标返回非法字节数: " + accepted, state.written);
            return false;
        }
        state.written += accepted;
        if (accepted < len) {
            state.failure = new TokenWriteException("短写: 期望 " + len + " 字节, 实际 " + accepted,
                    state.written);
            return false;
        }
        return true;
    }

    private static final class WriteState {
        long written;
        int tokenCount;
        TokenWriteException failure;
    }
}
