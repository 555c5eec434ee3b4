package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code @media}，queries 为逗号分隔的各个查询
 */
public final class CssMediaRule extends CssParentNode {

    private final List<String> queries;

    public CssMediaRule(List<String> queries, SourceLocation span) {
        super(span);
        this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public List<String> getQueries() {
        return queries;
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitMediaRule(this);
    }
}
