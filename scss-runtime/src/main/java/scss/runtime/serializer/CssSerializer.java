package scss.runtime.serializer;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.OutputStyle;
import scss.runtime.SassRuntimeException;
import scss.runtime.css.CssAtRule;
import scss.runtime.css.CssComment;
import scss.runtime.css.CssDeclaration;
import scss.runtime.css.CssImport;
import scss.runtime.css.CssKeyframeBlock;
import scss.runtime.css.CssMediaRule;
import scss.runtime.css.CssNode;
import scss.runtime.css.CssParentNode;
import scss.runtime.css.CssStyleRule;
import scss.runtime.css.CssStylesheet;
import scss.runtime.css.CssVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CSS 输出树到文本
 *
 * <p>按文档顺序遍历；不可见的节点（无内容的规则、空的带块 at 规则）不输出。
 * 同时记录每条规则与声明的输出位置，用于生成 source map。</p>
 */
public final class CssSerializer implements CssVisitor<Void> {

    private final boolean compressed;
    private final int precision;
    private final StringBuilder out = new StringBuilder();
    private final List<SourceMapEntry> mappings = new ArrayList<>();
    private int line;
    private int column;
    private int indentation;

    private CssSerializer(OutputStyle style, int precision) {
        this.compressed = style == OutputStyle.COMPRESSED;
        this.precision = precision;
    }

    /** 序列化结果 */
    public static final class Result {
        private final String css;
        private final List<SourceMapEntry> mappings;

        Result(String css, List<SourceMapEntry> mappings) {
            this.css = css;
            this.mappings = Collections.unmodifiableList(mappings);
        }

        public String getCss() {
            return css;
        }

        public List<SourceMapEntry> getMappings() {
            return mappings;
        }
    }

    /**
     * @param emitCharset 输出含非 ASCII 字符时，展开模式加 {@code @charset "UTF-8";}，压缩模式加 BOM
     */
    public static Result serialize(CssStylesheet stylesheet, OutputStyle style, int precision, boolean emitCharset) {
        CssSerializer serializer = new CssSerializer(style, precision);
        stylesheet.accept(serializer);
        String css = serializer.out.toString();
        List<SourceMapEntry> mappings = serializer.mappings;
        if (emitCharset && !isAscii(css)) {
            if (serializer.compressed) {
                css = "\uFEFF" + css;
            } else {
                css = "@charset \"UTF-8\";\n" + css;
                List<SourceMapEntry> shifted = new ArrayList<>(mappings.size());
                for (SourceMapEntry entry : mappings) {
                    shifted.add(entry.shiftLines(1));
                }
                mappings = shifted;
            }
        }
        return new Result(css, mappings);
    }

    private static boolean isAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0x7F) return false;
        }
        return true;
    }

    // ============ 节点 ============

    @Override
    public Void visitStylesheet(CssStylesheet node) {
        CssNode previous = null;
        for (CssNode child : node.getChildren()) {
            if (isSkipped(child)) continue;
            if (previous != null && !compressed) {
                write("\n");
                if (!(previous instanceof CssComment && child instanceof CssComment)) write("\n");
            }
            child.accept(this);
            previous = child;
        }
        if (!compressed && previous != null) write("\n");
        return null;
    }

    @Override
    public Void visitStyleRule(CssStyleRule node) {
        writeIndentation();
        mark(node.getSpan());
        write(node.getSelector().render(compressed));
        writeBlock(node);
        return null;
    }

    @Override
    public Void visitMediaRule(CssMediaRule node) {
        writeIndentation();
        mark(node.getSpan());
        write("@media ");
        write(String.join(compressed ? "," : ", ", node.getQueries()));
        writeBlock(node);
        return null;
    }

    @Override
    public Void visitAtRule(CssAtRule node) {
        writeIndentation();
        mark(node.getSpan());
        write("@");
        write(node.getName());
        if (node.getParams() != null && !node.getParams().isEmpty()) {
            write(" ");
            write(node.getParams());
        }
        if (node.isChildless()) {
            write(";");
            return null;
        }
        writeBlock(node);
        return null;
    }

    @Override
    public Void visitKeyframeBlock(CssKeyframeBlock node) {
        writeIndentation();
        mark(node.getSpan());
        write(String.join(compressed ? "," : ", ", node.getSelectors()));
        writeBlock(node);
        return null;
    }

    @Override
    public Void visitDeclaration(CssDeclaration node) {
        writeIndentation();
        mark(node.getSpan());
        write(node.getName());
        write(compressed ? ":" : ": ");
        if (node.isCustomProperty()) {
            write(node.getCustomValue());
            return null;
        }
        String value;
        try {
            value = ValueSerializer.serialize(node.getValue(), compressed, precision, false);
        } catch (SassRuntimeException e) {
            throw e.attachLocation(node.getValueSpan(), null);
        }
        write(value);
        if (node.isImportant()) {
            write(compressed ? "!important" : " !important");
        }
        return null;
    }

    @Override
    public Void visitComment(CssComment node) {
        writeIndentation();
        write(node.getText());
        return null;
    }

    @Override
    public Void visitImport(CssImport node) {
        writeIndentation();
        mark(node.getSpan());
        write("@import ");
        write(node.getUrl());
        if (node.getModifiers() != null && !node.getModifiers().isEmpty()) {
            write(" ");
            write(node.getModifiers());
        }
        write(";");
        return null;
    }

    // ============ 块 ============

    private void writeBlock(CssParentNode node) {
        write(compressed ? "{" : " {");
        indentation++;
        CssNode previous = null;
        for (CssNode child : node.getChildren()) {
            if (isSkipped(child)) continue;
            if (previous != null && requiresSemicolon(previous)) write(";");
            if (!compressed) write("\n");
            child.accept(this);
            previous = child;
        }
        if (previous != null && requiresSemicolon(previous) && !compressed) write(";");
        indentation--;
        if (!compressed) {
            write("\n");
            writeIndentation();
        }
        write("}");
    }

    private static boolean requiresSemicolon(CssNode node) {
        return node instanceof CssDeclaration;
    }

    private boolean isSkipped(CssNode node) {
        if (node.isInvisible()) return true;
        return compressed && node instanceof CssComment && !((CssComment) node).isPreserved();
    }

    // ============ 输出 ============

    private void writeIndentation() {
        if (compressed) return;
        for (int i = 0; i < indentation; i++) {
            write("  ");
        }
    }

    private void write(String text) {
        out.append(text);
        int newline = text.lastIndexOf('\n');
        if (newline < 0) {
            column += text.length();
            return;
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') line++;
        }
        column = text.length() - newline - 1;
    }

    private void mark(SourceLocation span) {
        if (span != null && span.isKnown()) {
            mappings.add(new SourceMapEntry(line, column, span));
        }
    }
}
