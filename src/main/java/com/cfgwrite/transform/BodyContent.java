package com.cfgwrite.transform;

import java.util.List;
import java.util.Optional;

/**
 * 查询 body 的结果：有序属性列表与诊断列表。
 *
 * <p>出错时不抛异常，而是在 diagnostics 中携带错误，由调用方在使用前检查。
 */
public record BodyContent(List<Attribute> attributes, List<Diagnostic> diagnostics) {

    public BodyContent {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static BodyContent of(List<Attribute> attributes) {
        return new BodyContent(attributes, List.of());
    }

    public static BodyContent failed(List<Diagnostic> diagnostics) {
        return new BodyContent(List.of(), diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public Optional<Attribute> attribute(String name) {
        return attributes.stream().filter(attribute -> attribute.name().equals(name)).findFirst();
    }
}
