package scss.runtime.interpreter;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 调用帧：一次函数、mixin 或 {@code @content} 调用
 *
 * <p>位置是调用处而不是声明处，与 Sass 堆栈跟踪的约定一致。</p>
 */
public final class SassCallFrame {

    private final String name;
    private final String fileName;
    private final int line;
    private final int column;

    public SassCallFrame(String name, String fileName, int line, int column) {
        this.name = name;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public static SassCallFrame at(String name, SourceLocation callSite) {
        SourceLocation loc = callSite != null ? callSite : SourceLocation.UNKNOWN;
        return new SassCallFrame(name, loc.getFile(), loc.getLine(), loc.getColumn());
    }

    public String getName() { return name; }
    public String getFileName() { return fileName; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        return fileName + " " + line + ":" + column + "  " + name;
    }
}
