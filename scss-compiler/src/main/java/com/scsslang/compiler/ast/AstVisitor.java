package com.scsslang.compiler.ast;

import com.scsslang.compiler.ast.decl.*;
import com.scsslang.compiler.ast.expr.*;
import com.scsslang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 根 ============

    default R visitStylesheet(Stylesheet node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitStyleRule(StyleRule node, C ctx) { return null; }

    default R visitDeclaration(Declaration node, C ctx) { return null; }

    default R visitVariableDecl(VariableDecl node, C ctx) { return null; }

    default R visitIfRule(IfRule node, C ctx) { return null; }

    default R visitEachRule(EachRule node, C ctx) { return null; }

    default R visitForRule(ForRule node, C ctx) { return null; }

    default R visitWhileRule(WhileRule node, C ctx) { return null; }

    default R visitMixinRule(MixinRule node, C ctx) { return null; }

    default R visitFunctionRule(FunctionRule node, C ctx) { return null; }

    default R visitIncludeRule(IncludeRule node, C ctx) { return null; }

    default R visitContentRule(ContentRule node, C ctx) { return null; }

    default R visitReturnRule(ReturnRule node, C ctx) { return null; }

    default R visitExtendRule(ExtendRule node, C ctx) { return null; }

    default R visitMediaRule(MediaRule node, C ctx) { return null; }

    default R visitAtRootRule(AtRootRule node, C ctx) { return null; }

    default R visitAtRule(AtRule node, C ctx) { return null; }

    default R visitImportRule(ImportRule node, C ctx) { return null; }

    default R visitUseRule(UseRule node, C ctx) { return null; }

    default R visitForwardRule(ForwardRule node, C ctx) { return null; }

    default R visitDebugRule(DebugRule node, C ctx) { return null; }

    default R visitWarnRule(WarnRule node, C ctx) { return null; }

    default R visitErrorRule(ErrorRule node, C ctx) { return null; }

    default R visitLoudComment(LoudComment node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitNumberLiteral(NumberLiteral node, C ctx) { return null; }

    default R visitStringExpr(StringExpr node, C ctx) { return null; }

    default R visitColorLiteral(ColorLiteral node, C ctx) { return null; }

    default R visitBooleanLiteral(BooleanLiteral node, C ctx) { return null; }

    default R visitNullLiteral(NullLiteral node, C ctx) { return null; }

    default R visitVariableExpr(VariableExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitListExpr(ListExpr node, C ctx) { return null; }

    default R visitMapExpr(MapExpr node, C ctx) { return null; }

    default R visitFunctionCallExpr(FunctionCallExpr node, C ctx) { return null; }

    default R visitInterpolatedFunctionExpr(InterpolatedFunctionExpr node, C ctx) { return null; }

    default R visitParenthesizedExpr(ParenthesizedExpr node, C ctx) { return null; }

    default R visitParentSelectorExpr(ParentSelectorExpr node, C ctx) { return null; }

    default R visitIfExpr(IfExpr node, C ctx) { return null; }
}
