package com.scsslang.compiler.ast.decl;

import com.scsslang.compiler.ast.AstNode;
import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 样式表根节点（一个 .scss 文件）
 */
public class Stylesheet extends AstNode {
    private final String url;
    private final List<Statement> children;
    private final boolean plainCss;

    public Stylesheet(SourceLocation location, String url, List<Statement> children) {
        this(location, url, children, false);
    }

    public Stylesheet(SourceLocation location, String url, List<Statement> children, boolean plainCss) {
        super(location);
        this.url = url;
        this.children = Collections.unmodifiableList(children);
        this.plainCss = plainCss;
    }

    /** 样式表来源标识（文件路径或 {@code <stdin>}） */
    public String getUrl() {
        return url;
    }

    public List<Statement> getChildren() {
        return children;
    }

    /** 是否为普通 .css 文件（不允许 Sass 特性） */
    public boolean isPlainCss() {
        return plainCss;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStylesheet(this, context);
    }
}
