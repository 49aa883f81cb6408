package com.cfgwrite.config;

/**
 * 全局常量定义
 * 
 * 包含序列化缓冲参数、词法分析参数和CLI输出参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 序列化参数 ====================
    /** 空格暂存缓冲区大小，前导空格按此块长分批写出 */
    public static final int SPACE_CHUNK_SIZE = 40;
    /** 空格暂存缓冲区允许的最大值 */
    public static final int MAX_SPACE_CHUNK_SIZE = 4096;
    
    // ==================== 生成代码风格 ====================
    /** 新生成代码中运算符两侧的空格数 */
    public static final int CANONICAL_OPERATOR_SPACES = 1;
    
    // ==================== CLI参数 ====================
    /** token 文本预览的最大字符数 */
    public static final int TOKEN_PREVIEW_CHARS = 60;
    /** 单个输入文件大小上限（64MB） */
    public static final long MAX_INPUT_BYTES = 64L * 1024 * 1024;
}
