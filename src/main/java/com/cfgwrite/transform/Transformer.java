package com.cfgwrite.transform;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 对 body 做（可能为空操作的）变换并返回新 body。
 *
 * <p>实现不得原地修改输入 body。变换调用本身不会失败，
 * 出错时应返回查询即报错的 body，参见 {@link ErrorBody}。
 */
@FunctionalInterface
public interface Transformer {

    Body transformBody(Body body);

    /**
     * 将普通函数适配为 Transformer。
     */
    static Transformer of(UnaryOperator<Body> function) {
        if (function == null) {
            throw new IllegalArgumentException("变换函数不能为空");
        }
        return function::apply;
    }

    /**
     * 按给定顺序依次应用各个 Transformer。
     */
    static Transformer chain(List<Transformer> transformers) {
        return new Chain(transformers);
    }

    static Transformer chain(Transformer... transformers) {
        return new Chain(List.of(transformers));
    }
}
