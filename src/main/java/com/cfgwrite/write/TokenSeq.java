package com.cfgwrite.write;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 由有序子节点组成的 token 树节点，展平结果为各子节点输出的顺序拼接。
 *
 * <p>编辑器通过替换某个子节点（例如某属性值对应的 token）修改文档，
 * 其余子节点的 token 流保持不变。编辑只能在两次遍历之间进行。
 */
public final class TokenSeq implements TokenGen {
    /** 不含任何 token 的序列，用于替换被删除的子树；不可编辑。 */
    public static final TokenSeq EMPTY = new TokenSeq(false);

    private final List<TokenGen> children;

    private TokenSeq(boolean editable) {
        this.children = editable ? new ArrayList<>() : List.of();
    }

    public TokenSeq() {
        this(true);
    }

    /**
     * 以给定子节点创建序列；{@code null} 列表视为空序列。
     */
    public TokenSeq(List<? extends TokenGen> children) {
        this(true);
        if (children != null) {
            for (TokenGen child : children) {
                add(child);
            }
        }
    }

    public static TokenSeq of(TokenGen... children) {
        return new TokenSeq(Arrays.asList(children));
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public TokenGen get(int index) {
        return children.get(index);
    }

    /**
     * 子节点的只读视图。
     */
    public List<TokenGen> children() {
        return Collections.unmodifiableList(children);
    }

    public TokenSeq add(TokenGen child) {
        children.add(requireChild(child));
        return this;
    }

    public TokenSeq add(int index, TokenGen child) {
        children.add(index, requireChild(child));
        return this;
    }

    /**
     * 替换指定位置的子树。
     *
     * @return 被替换的旧子树
     */
    public TokenGen set(int index, TokenGen child) {
        return children.set(index, requireChild(child));
    }

    public TokenGen remove(int index) {
        return children.remove(index);
    }

    /**
     * 深度优先先序遍历，使用显式栈以支持任意嵌套深度。
     */
    @Override
    public void eachToken(TokenCallback callback) {
        Deque<Iterator<TokenGen>> stack = new ArrayDeque<>();
        stack.push(children.iterator());
        while (!stack.isEmpty()) {
            Iterator<TokenGen> current = stack.peek();
            if (!current.hasNext()) {
                stack.pop();
                continue;
            }
            TokenGen child = current.next();
            if (child instanceof TokenSeq nested) {
                stack.push(nested.children.iterator());
            } else {
                child.eachToken(callback);
            }
        }
    }

    /**
     * 拒绝空子节点与自身；更深的环（把祖先加为子节点）不检查。
     */
    private TokenGen requireChild(TokenGen child) {
        if (child == null) {
            throw new IllegalArgumentException("子节点不能为空");
        }
        if (child == this) {
            throw new IllegalArgumentException("序列不能包含自身");
        }
        return child;
    }

    @Override
    public String toString() {
        return "TokenSeq" + children;
    }
}
