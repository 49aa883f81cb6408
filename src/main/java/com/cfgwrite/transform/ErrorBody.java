package com.cfgwrite.transform;

import java.util.List;

/**
 * 延迟报错的 body：外观与普通 body 相同，任何查询都只返回预设的诊断。
 *
 * <p>Transformer 出错时返回它，使错误推迟到结果被真正使用时才暴露。
 */
public final class ErrorBody implements Body {
    private final List<Diagnostic> diagnostics;

    public ErrorBody(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            throw new IllegalArgumentException("ErrorBody 至少需要一条诊断");
        }
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static ErrorBody of(String summary, String detail) {
        return new ErrorBody(List.of(Diagnostic.error(summary, detail)));
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    @Override
    public BodyContent justAttributes() {
        return BodyContent.failed(diagnostics);
    }

    @Override
    public String toString() {
        return "ErrorBody" + diagnostics;
    }
}
