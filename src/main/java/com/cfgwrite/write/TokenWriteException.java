package com.cfgwrite.write;

import java.io.IOException;

/**
 * 序列化中途失败，记录失败前已成功写出的字节数。
 */
public class TokenWriteException extends IOException {
    private final long bytesWritten;

    public TokenWriteException(String message, long bytesWritten, Throwable cause) {
        super(message + " (已写出 " + bytesWritten + " 字节)", cause);
        this.bytesWritten = bytesWritten;
    }

    public TokenWriteException(String message, long bytesWritten) {
        this(message, bytesWritten, null);
    }

    public long getBytesWritten() {
        return bytesWritten;
    }
}
