package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 可包含子节点的 CSS 节点
 */
public abstract class CssParentNode extends CssNode {

    private final List<CssNode> children = new ArrayList<>();

    protected CssParentNode(SourceLocation span) {
        super(span);
    }

    public List<CssNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(CssNode child) {
        checkMutable();
        child.setParent(this);
        children.add(child);
    }

    /** 在 index 处插入 */
    public void insertChild(int index, CssNode child) {
        checkMutable();
        child.setParent(this);
        children.add(index, child);
    }

    public boolean removeChild(CssNode child) {
        checkMutable();
        return children.remove(child);
    }

    /** 是否有声明子节点 */
    public boolean hasDeclarations() {
        for (CssNode child : children) {
            if (child instanceof CssDeclaration) return true;
        }
        return false;
    }

    @Override
    public boolean isInvisible() {
        for (CssNode child : children) {
            if (!child.isInvisible()) return false;
        }
        return true;
    }

    @Override
    public void freeze() {
        super.freeze();
        for (CssNode child : children) {
            child.freeze();
        }
    }
}
