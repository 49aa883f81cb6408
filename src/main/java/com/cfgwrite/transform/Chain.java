package com.cfgwrite.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 顺序组合的 Transformer。构造后不可变，可跨多个输入复用。
 *
 * <p>不因 body 已出错而短路：出错 body 在被查询前是惰性的，后续阶段照常执行。
 * 某阶段违反约定抛出运行时异常时，转换为携带该异常信息的 {@link ErrorBody}。
 */
public final class Chain implements Transformer {
    private static final Logger logger = LoggerFactory.getLogger(Chain.class);

    private final List<Transformer> stages;

    public Chain(List<Transformer> stages) {
        if (stages == null) {
            throw new IllegalArgumentException("变换阶段列表不能为空");
        }
        for (Transformer stage : stages) {
            if (stage == null) {
                throw new IllegalArgumentException("变换阶段不能为空");
            }
        }
        this.stages = List.copyOf(stages);
    }

    public List<Transformer> stages() {
        return stages;
    }

    @Override
    public Body transformBody(Body body) {
        Body current = body;
        for (int index = 0; index < stages.size(); index++) {
            current = applyStage(index, current);
        }
        return current;
    }

    private Body applyStage(int index, Body input) {
        Body output;
        try {
            output = stages.get(index).transformBody(input);
        } catch (RuntimeException exception) {
            logger.warn("变换阶段 {} 抛出异常，已转换为错误 body: {}", index, exception.toString());
            String detail = exception.getMessage() == null ? exception.getClass().getName() : exception.getMessage();
            return failedStage(input, Diagnostic.error("变换阶段 " + index + " 执行失败", detail));
        }
        if (output == null) {
            logger.warn("变换阶段 {} 返回 null，已转换为错误 body", index);
            return failedStage(input, Diagnostic.error("变换阶段 " + index + " 返回空 body", ""));
        }
        return output;
    }

    /**
     * 构造失败阶段的错误 body，保留输入 body 已携带的诊断。
     */
    private Body failedStage(Body input, Diagnostic failure) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (input instanceof ErrorBody errorBody) {
            diagnostics.addAll(errorBody.diagnostics());
        }
        diagnostics.add(failure);
        return new ErrorBody(diagnostics);
    }

    @Override
    public String toString() {
        return "Chain" + stages;
    }
}
