package scss.runtime.css;

/**
 * CSS 输出树访问者
 */
public interface CssVisitor<R> {

    R visitStylesheet(CssStylesheet node);

    R visitStyleRule(CssStyleRule node);

    R visitMediaRule(CssMediaRule node);

    R visitAtRule(CssAtRule node);

    R visitKeyframeBlock(CssKeyframeBlock node);

    R visitDeclaration(CssDeclaration node);

    R visitComment(CssComment node);

    R visitImport(CssImport node);
}
