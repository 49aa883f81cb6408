package com.cfgwrite.write;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * 字节输出目标：追加字节并返回实际接受的字节数。
 *
 * <p>返回值小于 {@code len} 视为短写，写出器会按失败处理。
 */
@FunctionalInterface
public interface ByteSink {

    int write(byte[] buf, int off, int len) throws IOException;

    /**
     * 适配 {@link OutputStream}，成功时视为全部接受。
     */
    static ByteSink of(OutputStream out) {
        if (out == null) {
            throw new IllegalArgumentException("输出流不能为空");
        }
        return (buf, off, len) -> {
            out.write(buf, off, len);
            return len;
        };
    }

    /**
     * 适配 {@link WritableByteChannel}，返回通道单次写入的字节数。
     */
    static ByteSink of(WritableByteChannel channel) {
        if (channel == null) {
            throw new IllegalArgumentException("通道不能为空");
        }
        return (buf, off, len) -> channel.write(ByteBuffer.wrap(buf, off, len));
    }

    /**
     * 内存缓冲目标。
     */
    final class Buffer implements ByteSink {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        @Override
        public int write(byte[] buf, int off, int len) {
            out.write(buf, off, len);
            return len;
        }

        public int size() {
            return out.size();
        }

        public byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
