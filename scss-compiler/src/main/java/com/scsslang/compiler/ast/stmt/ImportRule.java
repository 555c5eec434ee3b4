package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 旧式 {@code @import "a", "b";}
 */
public class ImportRule extends Statement {
    private final List<ImportTarget> targets;

    public ImportRule(SourceLocation location, List<ImportTarget> targets) {
        super(location);
        this.targets = Collections.unmodifiableList(targets);
    }

    public List<ImportTarget> getTargets() {
        return targets;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportRule(this, context);
    }

    /**
     * 单个导入目标。静态导入（{@code url()}、{@code .css}、{@code http://}、带媒体查询）原样输出为 CSS {@code @import}。
     */
    public static final class ImportTarget {
        private final SourceLocation location;
        private final String url;                  // 动态导入
        private final Interpolation staticImport;  // 静态导入的完整文本

        private ImportTarget(SourceLocation location, String url, Interpolation staticImport) {
            this.location = location;
            this.url = url;
            this.staticImport = staticImport;
        }

        public static ImportTarget dynamic(SourceLocation location, String url) {
            return new ImportTarget(location, url, null);
        }

        public static ImportTarget ofStatic(SourceLocation location, Interpolation text) {
            return new ImportTarget(location, null, text);
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getUrl() {
            return url;
        }

        public Interpolation getStaticImport() {
            return staticImport;
        }

        public boolean isStatic() {
            return staticImport != null;
        }
    }
}
