package com.cfgwrite.transform;

import com.cfgwrite.config.Constants;
import com.cfgwrite.syntax.TokenType;
import com.cfgwrite.write.Token;
import com.cfgwrite.write.TokenSeq;
import com.cfgwrite.write.Tokens;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 不可变的内存 body，按插入顺序保存属性。
 *
 * <p>所有修改操作都返回新实例，原实例保持不变。可携带警告级诊断，修改时一并保留。
 */
public final class AttributesBody implements Body {
    private static final AttributesBody EMPTY = new AttributesBody(List.of(), List.of());

    private final List<Attribute> attributes;
    private final List<Diagnostic> warnings;

    private AttributesBody(List<Attribute> attributes, List<Diagnostic> warnings) {
        this.attributes = attributes;
        this.warnings = warnings;
    }

    public static AttributesBody empty() {
        return EMPTY;
    }

    /**
     * 以属性列表创建 body，重名属性后者覆盖前者但保留首次出现的位置。
     */
    public static AttributesBody of(List<Attribute> attributes) {
        if (attributes == null) {
            throw new IllegalArgumentException("属性列表不能为空");
        }
        Map<String, Attribute> byName = new LinkedHashMap<>();
        for (Attribute attribute : attributes) {
            byName.put(attribute.name(), attribute);
        }
        return new AttributesBody(List.copyOf(byName.values()), List.of());
    }

    public static AttributesBody of(Attribute... attributes) {
        return of(List.of(attributes));
    }

    /**
     * 由查询结果创建 body，保留其属性与警告；含错误诊断的结果不能转换。
     */
    public static AttributesBody from(BodyContent content) {
        if (content == null) {
            throw new IllegalArgumentException("body 内容不能为空");
        }
        if (content.hasErrors()) {
            throw new IllegalArgumentException("body 内容含错误诊断");
        }
        return of(content.attributes()).withWarnings(content.diagnostics());
    }

    /**
     * 追加警告级诊断。
     */
    public AttributesBody withWarnings(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return this;
        }
        List<Diagnostic> merged = new ArrayList<>(warnings);
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                throw new IllegalArgumentException("不能附加错误诊断: " + diagnostic.summary());
            }
            merged.add(diagnostic);
        }
        return new AttributesBody(attributes, List.copyOf(merged));
    }

    /**
     * 设置属性：已存在则原位替换，否则追加到末尾。
     */
    public AttributesBody with(Attribute attribute) {
        if (attribute == null) {
            throw new IllegalArgumentException("属性不能为空");
        }
        List<Attribute> updated = new ArrayList<>(attributes.size() + 1);
        boolean replaced = false;
        for (Attribute existing : attributes) {
            if (existing.name().equals(attribute.name())) {
                updated.add(attribute);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(attribute);
        }
        return new AttributesBody(List.copyOf(updated), warnings);
    }

    public AttributesBody without(String name) {
        List<Attribute> updated = new ArrayList<>(attributes.size());
        for (Attribute existing : attributes) {
            if (!existing.name().equals(name)) {
                updated.add(existing);
            }
        }
        if (updated.size() == attributes.size()) {
            return this;
        }
        return new AttributesBody(List.copyOf(updated), warnings);
    }

    public List<Attribute> attributes() {
        return attributes;
    }

    public List<Diagnostic> warnings() {
        return warnings;
    }

    @Override
    public BodyContent justAttributes() {
        return new BodyContent(attributes, warnings);
    }

    /**
     * 以规范风格渲染为 token 树，每个属性一行 {@code name = value}。
     */
    public TokenSeq toTokenSeq() {
        TokenSeq seq = new TokenSeq();
        for (Attribute attribute : attributes) {
            seq.add(renderLine(attribute.name(), attribute.expr()));
        }
        return seq;
    }

    /**
     * 生成单行属性的 token：名称、等号、值（首个 token 前一个空格）与换行。
     */
    public static Tokens renderLine(String name, Tokens expr) {
        List<Token> line = new ArrayList<>(expr.size() + 3);
        line.add(Token.of(TokenType.IDENT, name));
        line.add(Token.of(TokenType.EQUAL, "=", Constants.CANONICAL_OPERATOR_SPACES));
        for (int index = 0; index < expr.size(); index++) {
            Token token = expr.get(index);
            line.add(index == 0 ? token.withSpacesBefore(Constants.CANONICAL_OPERATOR_SPACES) : token);
        }
        line.add(Token.of(TokenType.NEWLINE, "\n"));
        return new Tokens(line);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof AttributesBody that
                && attributes.equals(that.attributes)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return 31 * attributes.hashCode() + warnings.hashCode();
    }

    @Override
    public String toString() {
        return warnings.isEmpty() ? "AttributesBody" + attributes : "AttributesBody" + attributes + warnings;
    }
}
