package com.cfgwrite.transform;

/**
 * 语法内容抽象，由 AST / 解码层提供。
 *
 * <p>查询失败以 {@link BodyContent#diagnostics()} 返回，而不是抛出异常。
 */
public interface Body {

    /**
     * 以属性列表形式读取 body 内容。
     */
    BodyContent justAttributes();
}
