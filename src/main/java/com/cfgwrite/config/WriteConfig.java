package com.cfgwrite.config;

/**
 * 序列化运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class WriteConfig {
    private int spaceChunkSize = Constants.SPACE_CHUNK_SIZE;
    private boolean verifyRoundTrip = true;
    private int tokenPreviewChars = Constants.TOKEN_PREVIEW_CHARS;
    
    public int getSpaceChunkSize() {
        return spaceChunkSize;
    }
    
    public void setSpaceChunkSize(int spaceChunkSize) {
        if (spaceChunkSize <= 0 || spaceChunkSize > Constants.MAX_SPACE_CHUNK_SIZE) {
            throw new IllegalArgumentException("spaceChunkSize 超出范围 [1, "
                    + Constants.MAX_SPACE_CHUNK_SIZE + "]: " + spaceChunkSize);
        }
        this.spaceChunkSize = spaceChunkSize;
    }
    
    public boolean isVerifyRoundTrip() {
        return verifyRoundTrip;
    }
    
    public void setVerifyRoundTrip(boolean verifyRoundTrip) {
        this.verifyRoundTrip = verifyRoundTrip;
    }
    
    public int getTokenPreviewChars() {
        return tokenPreviewChars;
    }
    
    public void setTokenPreviewChars(int tokenPreviewChars) {
        if (tokenPreviewChars < 0) {
            throw new IllegalArgumentException("tokenPreviewChars 不能为负数: " + tokenPreviewChars);
        }
        this.tokenPreviewChars = tokenPreviewChars;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static WriteConfig defaults() {
        return new WriteConfig();
    }
}
