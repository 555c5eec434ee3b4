package com.scsslang.compiler.ast;

import com.scsslang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 插值文本：由纯文本片段（String）和 {@code #{...}} 表达式（Expression）交替组成。
 */
public final class Interpolation {
    private final List<Object> parts;
    private final SourceLocation location;

    public Interpolation(List<Object> parts, SourceLocation location) {
        List<Object> merged = new ArrayList<Object>(parts.size());
        for (Object part : parts) {
            if (!(part instanceof String) && !(part instanceof Expression)) {
                throw new IllegalArgumentException("Interpolation part must be String or Expression: " + part);
            }
            // 合并相邻文本片段
            if (part instanceof String && !merged.isEmpty() && merged.get(merged.size() - 1) instanceof String) {
                merged.set(merged.size() - 1, merged.get(merged.size() - 1) + (String) part);
            } else if (!(part instanceof String && ((String) part).isEmpty())) {
                merged.add(part);
            }
        }
        this.parts = Collections.unmodifiableList(merged);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static Interpolation plain(String text, SourceLocation location) {
        return new Interpolation(Collections.<Object>singletonList(text), location);
    }

    public List<Object> getParts() {
        return parts;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 不含任何插值表达式 */
    public boolean isPlain() {
        for (Object part : parts) {
            if (part instanceof Expression) return false;
        }
        return true;
    }

    /** 纯文本内容；含插值时返回 null */
    public String getAsPlain() {
        if (!isPlain()) return null;
        return parts.isEmpty() ? "" : (String) parts.get(0);
    }

    /** 开头的纯文本片段（用于 {@code --} 自定义属性等前缀判断） */
    public String getInitialPlain() {
        if (!parts.isEmpty() && parts.get(0) instanceof String) {
            return (String) parts.get(0);
        }
        return "";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof String) {
                sb.append(part);
            } else {
                sb.append("#{").append(part).append("}");
            }
        }
        return sb.toString();
    }
}
