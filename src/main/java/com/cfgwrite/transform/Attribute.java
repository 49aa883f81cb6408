package com.cfgwrite.transform;

import com.cfgwrite.write.Tokens;

/**
 * 属性：名称与其值表达式的 token。
 */
public record Attribute(String name, Tokens expr) {

    public Attribute {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("属性名不能为空");
        }
        if (expr == null) {
            throw new IllegalArgumentException("属性值不能为空: " + name);
        }
    }

    /**
     * 值表达式的文本形式，token 之间按记录的空格数拼接，首个 token 的前导空格忽略。
     */
    public String exprText() {
        StringBuilder builder = new StringBuilder();
        boolean first = true;
        for (var token : expr) {
            if (!first) {
                builder.append(" ".repeat(token.spacesBefore()));
            }
            builder.append(token.text());
            first = false;
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return name + " = " + exprText();
    }
}
