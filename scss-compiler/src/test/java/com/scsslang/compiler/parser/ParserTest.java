package com.scsslang.compiler.parser;

import com.scsslang.compiler.ast.decl.Stylesheet;
import com.scsslang.compiler.ast.expr.*;
import com.scsslang.compiler.ast.stmt.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Stylesheet parse(String source) {
        return Parser.parse(source, "test.scss");
    }

    private Statement first(String source) {
        List<Statement> children = parse(source).getChildren();
        assertFalse(children.isEmpty(), "no statements parsed");
        return children.get(0);
    }

    private Expression expression(String source) {
        return new Parser(source, "test.scss").parseExpression();
    }

    @Test
    @DisplayName("新建的解析器可直接用于各入口")
    void testFreshParserEntryPoints() {
        assertEquals(1, new Parser("a { b: c; }", "test.scss").parse().getChildren().size());
        assertTrue(new Parser("1 + 2", "test.scss").parseExpression() instanceof BinaryExpr);
        assertEquals(2, new Parser("($a, $b: 1)", "test.scss").parseArgumentDeclaration()
                .getParameters().size());
    }

    // ============ 变量 ============

    @Nested
    @DisplayName("变量声明")
    class VariableTests {

        @Test
        @DisplayName("名称不带 $")
        void testName() {
            VariableDecl decl = (VariableDecl) first("$primary: #333;");
            assertEquals("primary", decl.getName());
            assertNull(decl.getNamespace());
            assertFalse(decl.isGuarded());
            assertFalse(decl.isGlobal());
        }

        @Test
        @DisplayName("!default 与 !global 标志")
        void testFlags() {
            VariableDecl decl = (VariableDecl) first("$x: 1 !default !global;");
            assertTrue(decl.isGuarded());
            assertTrue(decl.isGlobal());
        }

        @Test
        @DisplayName("未知标志报错")
        void testInvalidFlag() {
            ParseException e = assertThrows(ParseException.class, () -> parse("$x: 1 !bogus;"));
            assertEquals("Invalid flag name.", e.getRawMessage());
        }

        @Test
        @DisplayName("模块变量赋值")
        void testNamespaced() {
            VariableDecl decl = (VariableDecl) first("lib.$x: 2;");
            assertEquals("lib", decl.getNamespace());
            assertEquals("x", decl.getName());
        }
    }

    // ============ 样式规则 ============

    @Nested
    @DisplayName("样式规则与声明")
    class StyleRuleTests {

        @Test
        @DisplayName("嵌套规则与声明")
        void testNested() {
            StyleRule rule = (StyleRule) first(".a { color: red; .b { color: blue; } }");
            assertEquals(".a", rule.getSelector().getAsPlain().trim());
            assertEquals(2, rule.getChildren().size());
            assertTrue(rule.getChildren().get(0) instanceof Declaration);
            assertTrue(rule.getChildren().get(1) instanceof StyleRule);
        }

        @Test
        @DisplayName("!important")
        void testImportant() {
            StyleRule rule = (StyleRule) first("a { color: red !important; }");
            Declaration decl = (Declaration) rule.getChildren().get(0);
            assertTrue(decl.isImportant());
            assertTrue(decl.getValue() instanceof ColorLiteral);

            Declaration display = (Declaration) ((StyleRule) first("a { display: block !important; }"))
                    .getChildren().get(0);
            assertTrue(display.isImportant());
            assertTrue(display.getValue() instanceof StringExpr);
        }

        @Test
        @DisplayName("自定义属性保留原文")
        void testCustomProperty() {
            StyleRule rule = (StyleRule) first("a { --gap: 1px  2px; }");
            Declaration decl = (Declaration) rule.getChildren().get(0);
            assertTrue(decl.isCustomProperty());
            assertNull(decl.getValue());
        }

        @Test
        @DisplayName("嵌套属性")
        void testNestedProperty() {
            StyleRule rule = (StyleRule) first("a { font: { family: serif; size: 2px; } }");
            Declaration decl = (Declaration) rule.getChildren().get(0);
            assertNull(decl.getValue());
            assertEquals(2, decl.getChildren().size());
        }

        @Test
        @DisplayName("插值选择器")
        void testInterpolatedSelector() {
            StyleRule rule = (StyleRule) first(".item-#{$i} { width: 1px; }");
            assertFalse(rule.getSelector().isPlain());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("数字字面量之间的 / 保留斜杠")
        void testSlashLiteral() {
            Expression expr = expression("1/2");
            assertTrue(expr instanceof BinaryExpr);
            BinaryExpr binary = (BinaryExpr) expr;
            assertEquals(BinaryExpr.BinaryOp.DIV, binary.getOperator());
            assertTrue(binary.allowsSlash());
        }

        @Test
        @DisplayName("变量参与的 / 是除法")
        void testSlashWithVariable() {
            BinaryExpr binary = (BinaryExpr) expression("$a/2");
            assertFalse(binary.allowsSlash());
        }

        @Test
        @DisplayName("运算符优先级")
        void testPrecedence() {
            BinaryExpr binary = (BinaryExpr) expression("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, binary.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) binary.getRight()).getOperator());
        }

        @Test
        @DisplayName("逗号列表")
        void testCommaList() {
            ListExpr list = (ListExpr) expression("1, 2, 3");
            assertEquals(ListExpr.Separator.COMMA, list.getSeparator());
            assertEquals(3, list.getElements().size());
        }

        @Test
        @DisplayName("map 字面量")
        void testMap() {
            MapExpr map = (MapExpr) expression("(a: 1, b: 2)");
            assertEquals(2, map.getKeys().size());
            assertEquals(2, map.getValues().size());
        }

        @Test
        @DisplayName("命名空间函数调用")
        void testNamespacedCall() {
            FunctionCallExpr call = (FunctionCallExpr) expression("math.div(1, 2)");
            assertEquals("math", call.getNamespace());
            assertEquals("div", call.getName());
            assertEquals(2, call.getArguments().getPositional().size());
        }

        @Test
        @DisplayName("if() 是特殊形式")
        void testIfExpression() {
            assertTrue(expression("if($x, red, blue)") instanceof IfExpr);
        }
    }

    // ============ at 规则 ============

    @Nested
    @DisplayName("at 规则")
    class AtRuleTests {

        @Test
        @DisplayName("@use 默认命名空间取文件名")
        void testUseDefaultNamespace() {
            UseRule use = (UseRule) first("@use 'src/_corners.scss';");
            assertEquals("corners", use.getNamespace());
        }

        @Test
        @DisplayName("@use as * 没有命名空间")
        void testUseGlobal() {
            UseRule use = (UseRule) first("@use 'colors' as *;");
            assertTrue(use.isGlobalNamespace());
        }

        @Test
        @DisplayName("@use with 配置")
        void testUseWith() {
            UseRule use = (UseRule) first("@use 'lib' with ($a: 1, $b: 2);");
            assertEquals(2, use.getConfiguration().size());
            assertEquals("a", use.getConfiguration().get(0).getName());
        }

        @Test
        @DisplayName("@forward 前缀与 show")
        void testForward() {
            ForwardRule forward = (ForwardRule) first("@forward 'lib' as lib-* show mix, $var;");
            assertEquals("lib-", forward.getPrefix());
            assertNotNull(forward.getShown());
            assertNull(forward.getHidden());
        }

        @Test
        @DisplayName("@include 带内容块参数")
        void testIncludeWithContent() {
            IncludeRule include = (IncludeRule) first("@include m(1) using ($x) { a: $x; }");
            assertEquals("m", include.getName());
            assertTrue(include.hasContent());
            assertEquals(1, include.getContent().getParameters().getParameters().size());
        }

        @Test
        @DisplayName("@if / @else if / @else")
        void testIfChain() {
            IfRule rule = (IfRule) first("@if $a { x: 1; } @else if $b { x: 2; } @else { x: 3; }");
            assertEquals(2, rule.getClauses().size());
            assertTrue(rule.hasElse());
        }

        @Test
        @DisplayName("@for through / to")
        void testFor() {
            ForRule inclusive = (ForRule) first("@for $i from 1 through 3 {}");
            ForRule exclusive = (ForRule) first("@for $i from 1 to 3 {}");
            assertEquals("i", inclusive.getVariable());
            assertFalse(inclusive.isExclusive());
            assertTrue(exclusive.isExclusive());
        }

        @Test
        @DisplayName("@each 解构多个变量")
        void testEachDestructuring() {
            EachRule rule = (EachRule) first("@each $k, $v in $map {}");
            assertEquals(2, rule.getVariables().size());
        }

        @Test
        @DisplayName("@charset 被丢弃")
        void testCharsetDropped() {
            assertTrue(parse("@charset \"UTF-8\";").getChildren().isEmpty());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("错误带位置")
        void testErrorLocation() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a {\n  color: red\n  b: c; }}"));
            assertNotNull(e.getLocation());
            assertTrue(e.getLocation().getLine() >= 2);
        }

        @Test
        @DisplayName("未闭合的块")
        void testUnclosedBlock() {
            assertThrows(ParseException.class, () -> parse("a { color: red;"));
        }
    }
}
