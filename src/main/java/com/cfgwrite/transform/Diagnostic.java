package com.cfgwrite.transform;

/**
 * 延迟上报的诊断信息。
 */
public record Diagnostic(Severity severity, String summary, String detail) {

    /** 诊断级别 */
    public enum Severity {
        ERROR,
        WARNING
    }

    public Diagnostic {
        if (severity == null) {
            throw new IllegalArgumentException("诊断级别不能为空");
        }
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("诊断摘要不能为空");
        }
        detail = detail == null ? "" : detail;
    }

    public static Diagnostic error(String summary, String detail) {
        return new Diagnostic(Severity.ERROR, summary, detail);
    }

    public static Diagnostic warning(String summary, String detail) {
        return new Diagnostic(Severity.WARNING, summary, detail);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
