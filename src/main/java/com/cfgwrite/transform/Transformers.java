package com.cfgwrite.transform;

import com.cfgwrite.write.Tokens;

/**
 * 常用 Transformer 集合。
 *
 * <p>输入 body 已携带错误时原样传递，不再读取其内容；警告随结果 body 保留。
 */
public final class Transformers {

    private Transformers() {
        // 工具类，禁止实例化
    }

    public static Transformer identity() {
        return body -> body;
    }

    /**
     * 设置属性值：已存在则原位替换，否则追加。
     */
    public static Transformer setAttribute(String name, Tokens expr) {
        Attribute attribute = new Attribute(name, expr);
        return body -> {
            BodyContent content = body.justAttributes();
            if (content.hasErrors()) {
                return body;
            }
            return AttributesBody.from(content).with(attribute);
        };
    }

    public static Transformer removeAttribute(String name) {
        requireName(name);
        return body -> {
            BodyContent content = body.justAttributes();
            if (content.hasErrors()) {
                return body;
            }
            return AttributesBody.from(content).without(name);
        };
    }

    /**
     * 要求属性存在，缺失时返回延迟报错的 body。
     */
    public static Transformer requireAttribute(String name) {
        requireName(name);
        return body -> {
            BodyContent content = body.justAttributes();
            if (content.hasErrors()) {
                return body;
            }
            if (content.attribute(name).isEmpty()) {
                return ErrorBody.of("缺少必需属性", "属性 \"" + name + "\" 未定义");
            }
            return body;
        };
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("属性名不能为空");
        }
    }
}
