package scss.runtime.serializer;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 源码映射条目：输出位置（行列从 0 开始）到原始 span
 */
public final class SourceMapEntry {

    private final int generatedLine;
    private final int generatedColumn;
    private final SourceLocation original;

    public SourceMapEntry(int generatedLine, int generatedColumn, SourceLocation original) {
        this.generatedLine = generatedLine;
        this.generatedColumn = generatedColumn;
        this.original = original;
    }

    public int getGeneratedLine() {
        return generatedLine;
    }

    public int getGeneratedColumn() {
        return generatedColumn;
    }

    public SourceLocation getOriginal() {
        return original;
    }

    SourceMapEntry shiftLines(int lines) {
        return new SourceMapEntry(generatedLine + lines, generatedColumn, original);
    }

    @Override
    public String toString() {
        return generatedLine + ":" + generatedColumn + " -> " + original;
    }
}
