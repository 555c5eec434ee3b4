package scss.runtime;

import com.scsslang.compiler.ast.decl.Stylesheet;
import com.scsslang.compiler.ast.stmt.Declaration;
import com.scsslang.compiler.ast.stmt.Statement;
import com.scsslang.compiler.ast.stmt.StyleRule;
import com.scsslang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scss.runtime.loader.InMemoryModuleLoader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端编译测试
 */
class SassCompilerTest {

    private static final InMemoryModuleLoader EMPTY = InMemoryModuleLoader.builder().build();

    private static String compile(String source) {
        return compile(source, CompileOptions.defaults());
    }

    private static String compile(String source, CompileOptions options) {
        CompileResult result = new SassCompiler(EMPTY, options).compile(source, "main.scss");
        assertTrue(result.isSuccess(), () -> "compile failed: " + result.getError());
        return result.getCss();
    }

    private static String compressed(String source) {
        return compile(source, CompileOptions.compressed());
    }

    private static Diagnostic error(String source) {
        return error(new SassCompiler(EMPTY), source);
    }

    private static Diagnostic error(SassCompiler compiler, String source) {
        CompileResult result = compiler.compile(source, "main.scss");
        assertFalse(result.isSuccess(), () -> "expected failure but got:\n" + result.getCss());
        assertNull(result.getCss());
        return result.getError();
    }

    // ============ 基本输出 ============

    @Nested
    @DisplayName("基本输出")
    class BasicTests {

        @Test
        @DisplayName("变量与 if()")
        void testIfFunction() {
            assertEquals(".a {\n  color: red;\n}\n", compile("$x: true; .a { color: if($x, red, blue); }"));
        }

        @Test
        @DisplayName("空输入")
        void testEmpty() {
            assertEquals("", compile(""));
        }

        @Test
        @DisplayName("顶层节点之间空一行")
        void testBlankLineBetweenRules() {
            assertEquals("a {\n  x: 1;\n}\n\nb {\n  y: 2;\n}\n", compile("a { x: 1 } b { y: 2 }"));
        }

        @Test
        @DisplayName("嵌套规则展平")
        void testNesting() {
            String css = compile(".a, .b { color: red; .c { color: blue; } &:hover { color: green; } }");
            assertEquals(".a, .b {\n  color: red;\n}\n\n"
                    + ".a .c, .b .c {\n  color: blue;\n}\n\n"
                    + ".a:hover, .b:hover {\n  color: green;\n}\n", css);
        }

        @Test
        @DisplayName("没有声明的规则不输出")
        void testEmptyRule() {
            assertEquals("", compile(".a { .b { } }"));
        }

        @Test
        @DisplayName("嵌套属性")
        void testNestedProperties() {
            assertEquals("a {\n  font-family: serif;\n  font-size: 2px;\n}\n",
                    compile("a { font: { family: serif; size: 2px; } }"));
        }

        @Test
        @DisplayName("!important 与自定义属性")
        void testImportantAndCustomProperty() {
            assertEquals("a {\n  color: red !important;\n  --gap: 1px 2px;\n}\n",
                    compile("a { color: red !important; --gap: 1px 2px; }"));
        }

        @Test
        @DisplayName("null 值的声明被省略")
        void testNullDeclaration() {
            assertEquals("a {\n  y: 1;\n}\n", compile("a { x: null; y: 1; }"));
        }

        @Test
        @DisplayName("保留的注释")
        void testLoudComment() {
            assertEquals("/* hi */\n\na {\n  x: 1;\n}\n", compile("/* hi */\na { x: 1; }"));
        }

        @Test
        @DisplayName("非 ASCII 输出加 @charset")
        void testCharset() {
            assertEquals("@charset \"UTF-8\";\na {\n  content: \"é\";\n}\n", compile("a { content: \"é\"; }"));
            CompileOptions noCharset = CompileOptions.builder().emitCharset(false).build();
            assertEquals("a {\n  content: \"é\";\n}\n", compile("a { content: \"é\"; }", noCharset));
        }

        @Test
        @DisplayName("多次编译输出一致")
        void testDeterministic() {
            String source = "@use 'sass:math'; $l: 1 2 3; @each $i in $l { .x-#{$i} { w: math.div($i, 3); } }";
            assertEquals(compile(source), compile(source));
        }

        @Test
        @DisplayName("输出的纯声明规则可重新解析")
        void testRoundTrip() {
            String css = compile("$w: 50%; .a { color: red; margin: 1px 2px !important; width: $w; }");
            assertEquals(css, compile(css));

            Stylesheet sheet = Parser.parse(css, "out.css");
            StyleRule rule = (StyleRule) sheet.getChildren().get(0);
            List<String> triples = new ArrayList<>();
            for (Statement child : rule.getChildren()) {
                Declaration declaration = (Declaration) child;
                triples.add(declaration.getName().getAsPlain() + "|" + declaration.isImportant());
            }
            assertEquals(Arrays.asList("color|false", "margin|true", "width|false"), triples);
        }
    }

    // ============ 压缩模式 ============

    @Nested
    @DisplayName("压缩模式")
    class CompressedTests {

        @Test
        @DisplayName("@each 生成规则")
        void testEach() {
            assertEquals(".item-1{width:10px}.item-2{width:20px}.item-3{width:30px}",
                    compressed("@each $i in 1, 2, 3 { .item-#{$i} { width: $i * 10px; } }"));
        }

        @Test
        @DisplayName("数字与颜色缩写")
        void testMinify() {
            assertEquals("a{x:.5;c:red;d:#abc}", compressed("a { x: 0.5; c: #ff0000; d: #aabbcc; }"));
        }

        @Test
        @DisplayName("选择器列表紧凑")
        void testSelectorList() {
            assertEquals(".a,.b>.c{x:1}", compressed(".a, .b > .c { x: 1; }"));
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式与内置函数")
    class ExpressionTests {

        @Test
        @DisplayName("字面量之间的 / 保留原样")
        void testSlashLiteral() {
            assertEquals(".a {\n  width: 1/2;\n}\n", compile(".a { width: 1/2; }"));
        }

        @Test
        @DisplayName("math.div 做除法")
        void testMathDiv() {
            assertEquals(".a {\n  width: 0.5;\n}\n", compile("@use 'sass:math'; .a { width: math.div(1, 2); }"));
        }

        @Test
        @DisplayName("变量参与的 / 做除法并给出弃用警告")
        void testSlashDivisionDeprecation() {
            CompileResult result = new SassCompiler(EMPTY).compile("$a: 4px; .a { w: $a / 2; }", "main.scss");
            assertTrue(result.isSuccess());
            assertEquals(".a {\n  w: 2px;\n}\n", result.getCss());
            assertTrue(result.getDiagnostics().stream()
                    .anyMatch(d -> d.getSeverity() == Diagnostic.Severity.DEPRECATION));
        }

        @Test
        @DisplayName("单位运算")
        void testUnits() {
            assertEquals("a {\n  w: 97px;\n}\n", compile("a { w: 1px + 1in; }"));
        }

        @Test
        @DisplayName("不兼容单位报错")
        void testIncompatibleUnits() {
            Diagnostic error = error("a { w: 1px + 1s; }");
            assertEquals("Incompatible units s and px.", error.getMessage());
            assertEquals(1, error.getPrimarySpan().getLine());
        }

        @Test
        @DisplayName("字符串插值与引号")
        void testStrings() {
            assertEquals("a {\n  b: \"x-1\";\n  c: x-1;\n}\n",
                    compile("$n: 1; a { b: \"x-#{$n}\"; c: x-#{$n}; }"));
        }

        @Test
        @DisplayName("map 与 list 函数")
        void testMapAndList() {
            String css = compile("$m: (a: 1, b: 2); x { y: map-get($m, b); z: length(1 2 3); w: nth(a b c, -1); }");
            assertEquals("x {\n  y: 2;\n  z: 3;\n  w: c;\n}\n", css);
        }

        @Test
        @DisplayName("颜色函数")
        void testColorFunctions() {
            assertEquals("a {\n  c: #1a1a1a;\n}\n", compile("a { c: lighten(#000, 10%); }"));
        }

        @Test
        @DisplayName("meta 函数")
        void testMetaFunctions() {
            assertEquals("a {\n  t: number;\n  i: (a: 1);\n}\n",
                    compile("a { t: type-of(1px); i: inspect((a: 1)); }"));
        }

        @Test
        @DisplayName("未知函数按纯 CSS 输出")
        void testPlainCssFunction() {
            assertEquals("a {\n  w: calc(100% - 10px);\n  t: translate(1px, 2px);\n}\n",
                    compile("a { w: calc(100% - 10px); t: translate(1px, 2px); }"));
        }

        @Test
        @DisplayName("未定义变量")
        void testUndefinedVariable() {
            assertEquals("Undefined variable.", error("a { b: $nope; }").getMessage());
        }

        @Test
        @DisplayName("random() 指定种子后可复现")
        void testSeededRandom() {
            CompileOptions seeded = CompileOptions.builder().seed(42L).build();
            String source = "a { r: random(100); }";
            assertEquals(compile(source, seeded), compile(source, seeded));
        }

        @Test
        @DisplayName("unique-id() 生成 6 位标识符且按种子可复现")
        void testUniqueId() {
            CompileOptions seeded = CompileOptions.builder().seed(7L).build();
            String source = "a { x: unique-id(); y: unique-id(); }";
            String css = compile(source, seeded);
            assertTrue(css.matches("a \\{\n  x: u[0-9a-z]{6};\n  y: u[0-9a-z]{6};\n}\n"), css);
            assertEquals(css, compile(source, seeded));

            for (long seed = 0; seed < 50; seed++) {
                String id = compile("a { x: unique-id(); }", CompileOptions.builder().seed(seed).build());
                assertTrue(id.matches("a \\{\n  x: u[0-9a-z]{6};\n}\n"), id);
            }
        }

        @Test
        @DisplayName("未指定种子时 unique-id() 也能正常编译")
        void testUniqueIdWithoutSeed() {
            CompileResult result = new SassCompiler(EMPTY).compile("a { x: unique-id(); }", "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
        }
    }

    // ============ 控制流与可调用 ============

    @Nested
    @DisplayName("控制流、函数与 mixin")
    class ControlFlowTests {

        @Test
        @DisplayName("@for 与 @if")
        void testForAndIf() {
            String css = compressed("@for $i from 1 through 4 { @if $i % 2 == 0 { .e-#{$i} { x: $i; } } }");
            assertEquals(".e-2{x:2}.e-4{x:4}", css);
        }

        @Test
        @DisplayName("函数体内不能 @include")
        void testIncludeInsideFunction() {
            Diagnostic error = error("@mixin m { @return 5; } @function f() { @include m; @return 1; } a { x: f(); }");
            assertEquals("Mixins may not be used within functions.", error.getMessage());

            Diagnostic plain = error("@mixin m { b: 1; } @function f() { @include m; @return 1; } a { x: f(); }");
            assertEquals("Mixins may not be used within functions.", plain.getMessage());
        }

        @Test
        @DisplayName("@for to 不含终点")
        void testForExclusive() {
            assertEquals(".a-1{x:1}.a-2{x:2}", compressed("@for $i from 1 to 3 { .a-#{$i} { x: $i; } }"));
        }

        @Test
        @DisplayName("@while 与根层半全局变量")
        void testWhile() {
            assertEquals("a{n:3}", compressed("$i: 0; @while $i < 3 { $i: $i + 1; } a { n: $i; }"));
        }

        @Test
        @DisplayName("@while 超过迭代上限")
        void testWhileLimit() {
            CompileOptions options = CompileOptions.builder().maxLoopIterations(10).build();
            Diagnostic error = error(new SassCompiler(EMPTY, options), "$i: 0; @while true { $i: $i + 1; }");
            assertEquals("@while loop exceeded 10 iterations.", error.getMessage());
        }

        @Test
        @DisplayName("@each 解构 map")
        void testEachMap() {
            assertEquals(".a{c:red}.b{c:blue}",
                    compressed("@each $k, $v in (a: red, b: blue) { .#{$k} { c: $v; } }"));
        }

        @Test
        @DisplayName("函数、缺省参数与可变参数")
        void testFunctions() {
            String source = "@function sum($a, $b: 10, $rest...) {"
                    + "  $total: $a + $b;"
                    + "  @each $n in $rest { $total: $total + $n; }"
                    + "  @return $total;"
                    + "}"
                    + "a { x: sum(1); y: sum(1, 2, 3, 4); z: sum($b: 1, $a: 2); }";
            assertEquals("a{x:11;y:10;z:3}", compressed(source));
        }

        @Test
        @DisplayName("函数没有 @return")
        void testFunctionWithoutReturn() {
            Diagnostic error = error("@function f() { $x: 1; } a { b: f(); }");
            assertEquals("Function finished without @return.", error.getMessage());
        }

        @Test
        @DisplayName("参数个数错误")
        void testArity() {
            Diagnostic error = error("@function f($a) { @return $a; } a { b: f(1, 2); }");
            assertEquals("Only 1 argument allowed, but 2 were passed.", error.getMessage());
        }

        @Test
        @DisplayName("递归超过调用深度")
        void testRecursionLimit() {
            CompileOptions options = CompileOptions.builder().maxCallDepth(20).build();
            Diagnostic error = error(new SassCompiler(EMPTY, options),
                    "@function f($n) { @return f($n + 1); } a { b: f(0); }");
            assertEquals("Stack depth exceeded max of 20.", error.getMessage());
        }

        @Test
        @DisplayName("mixin 与内容块")
        void testMixinContent() {
            String source = "@mixin hover($c) { &:hover { color: $c; @content; } }"
                    + ".btn { @include hover(red) { x: 1; } }";
            assertEquals(".btn:hover{color:red;x:1}", compressed(source));
        }

        @Test
        @DisplayName("内容块参数")
        void testContentArguments() {
            String source = "@mixin each-size { @each $s in 1, 2 { @content($s); } }"
                    + "@include each-size using ($size) { .s-#{$size} { w: $size * 1px; } }";
            assertEquals(".s-1{w:1px}.s-2{w:2px}", compressed(source));
        }

        @Test
        @DisplayName("未定义 mixin")
        void testUndefinedMixin() {
            assertEquals("Undefined mixin.", error("a { @include nope; }").getMessage());
        }

        @Test
        @DisplayName("@error 中止编译并带调用栈")
        void testUserError() {
            Diagnostic error = error("@function f() { @error \"boom\"; } a { b: f(); }");
            assertEquals("boom", error.getMessage());
            assertNotNull(error.getStackTrace());
        }

        @Test
        @DisplayName("@warn 与 @debug 记为诊断")
        void testWarnAndDebug() {
            CompileResult result = new SassCompiler(EMPTY).compile("@warn \"careful\"; @debug 1 + 1;", "main.scss");
            assertTrue(result.isSuccess());
            assertEquals(2, result.getDiagnostics().size());
            assertEquals(Diagnostic.Severity.WARNING, result.getDiagnostics().get(0).getSeverity());
            assertEquals("careful", result.getDiagnostics().get(0).getMessage());
            assertEquals(Diagnostic.Severity.DEBUG, result.getDiagnostics().get(1).getSeverity());
            assertEquals("2", result.getDiagnostics().get(1).getMessage());
        }
    }

    // ============ @extend ============

    @Nested
    @DisplayName("@extend")
    class ExtendTests {

        @Test
        @DisplayName("扩展占位符")
        void testPlaceholder() {
            String css = compile("%msg { color: red; } .a { @extend %msg; } .b { @extend %msg; }");
            assertEquals(".a, .b {\n  color: red;\n}\n", css);
            assertFalse(css.contains("%msg"));
        }

        @Test
        @DisplayName("转义的类名可作为扩展目标")
        void testEscapedTarget() {
            assertEquals(".a, .b {\n  x: 1;\n}\n", compile(".\\61 { x: 1 } .b { @extend .a; }"));
            assertEquals(".\\31 23, .c {\n  y: 2;\n}\n", compile(".\\31 23 { y: 2 } .c { @extend .\\31 23; }"));
        }

        @Test
        @DisplayName("以数字开头的转义类名原样输出")
        void testEscapedDigitClass() {
            assertEquals(".\\31 23 {\n  y: 2;\n}\n", compile(".\\31 23 { y: 2 }"));
            assertEquals(".\\31 23{y:2}", compressed(".\\31 23 { y: 2 }"));
        }

        @Test
        @DisplayName("未扩展的占位符不输出")
        void testUnusedPlaceholder() {
            assertEquals("", compile("%unused { color: red; }"));
        }

        @Test
        @DisplayName("扩展作用于后出现的规则")
        void testExtendLaterRule() {
            assertEquals(".a,.b{x:1}", compressed(".b { @extend .a; } .a { x: 1; }"));
        }

        @Test
        @DisplayName("目标不存在报错")
        void testMissingTarget() {
            Diagnostic error = error(".b { @extend .missing; }");
            assertTrue(error.getMessage().startsWith("The target selector was not found."));
            assertEquals("", compile(".b { @extend .missing !optional; }"));
        }

        @Test
        @DisplayName("@extend 只能在规则内")
        void testExtendOutsideRule() {
            assertEquals("@extend may only be used within style rules.", error("@extend .a;").getMessage());
        }

        @Test
        @DisplayName("不能跨媒体查询扩展")
        void testAcrossMedia() {
            Diagnostic error = error(".a { x: 1; } @media print { .b { @extend .a; } }");
            assertEquals("You may not @extend selectors across media queries.", error.getMessage());
        }
    }

    // ============ at 规则 ============

    @Nested
    @DisplayName("@media、@at-root 与其他 at 规则")
    class AtRuleTests {

        @Test
        @DisplayName("@media 冒泡到顶层")
        void testMediaBubbling() {
            assertEquals("@media print {\n  .a {\n    color: red;\n  }\n}\n",
                    compile(".a { @media print { color: red; } }"));
        }

        @Test
        @DisplayName("嵌套 @media 合并查询")
        void testNestedMedia() {
            assertEquals("@media screen and (min-width: 10px){a{x:1}}",
                    compressed("@media screen { @media (min-width: 10px) { a { x: 1; } } }"));
        }

        @Test
        @DisplayName("@at-root 跳出嵌套")
        void testAtRoot() {
            assertEquals(".a{x:1}.b{y:2}", compressed(".a { x: 1; @at-root .b { y: 2; } }"));
        }

        @Test
        @DisplayName("@keyframes 块不展开选择器")
        void testKeyframes() {
            assertEquals("@keyframes spin{from{r:0}to{r:1}}",
                    compressed("@keyframes spin { from { r: 0; } to { r: 1; } }"));
        }

        @Test
        @DisplayName("纯 CSS @import 置于最前")
        void testCssImport() {
            String css = compile("a { x: 1; } @import \"theme.css\";");
            assertTrue(css.startsWith("@import \"theme.css\";"), css);
        }

        @Test
        @DisplayName("声明只能在规则内")
        void testDeclarationOutsideRule() {
            assertEquals("Declarations may only be used within style rules.",
                    error("@mixin m { x: 1; } @include m;").getMessage());
        }
    }

    // ============ 模块 ============

    @Nested
    @DisplayName("模块系统")
    class ModuleTests {

        private SassCompiler compiler(InMemoryModuleLoader loader) {
            return new SassCompiler(loader);
        }

        @Test
        @DisplayName("@use 命名空间访问变量")
        void testUseNamespace() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("colors.scss", "$primary: #333;");
            CompileResult result = compiler(loader).compile("@use \"colors\" as c; .a { color: c.$primary; }",
                    "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertEquals(".a {\n  color: #333;\n}\n", result.getCss());
            assertTrue(result.getLoadedUrls().contains("colors.scss"));
        }

        @Test
        @DisplayName("不带命名空间访问模块变量报错")
        void testUseWithoutNamespace() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("colors.scss", "$primary: #333;");
            Diagnostic error = error(compiler(loader), "@use \"colors\" as c; .a { color: $primary; }");
            assertEquals("Undefined variable.", error.getMessage());
        }

        @Test
        @DisplayName("局部文件与 as *")
        void testPartialAndGlobalNamespace() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("lib/_sizes.scss",
                    "$gap: 4px; @function double($x) { @return $x * 2; }");
            CompileResult result = compiler(loader).compile("@use 'lib/sizes' as *; a { g: double($gap); }",
                    "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertEquals("a {\n  g: 8px;\n}\n", result.getCss());
        }

        @Test
        @DisplayName("with 配置 !default 变量")
        void testConfiguration() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("theme.scss",
                    "$color: red !default; .t { c: $color; }");
            CompileResult result = compiler(loader).compile("@use 'theme' with ($color: blue);", "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertEquals(".t {\n  c: blue;\n}\n", result.getCss());
        }

        @Test
        @DisplayName("配置未声明 !default 的变量报错")
        void testInvalidConfiguration() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("theme.scss", "$color: red;");
            Diagnostic error = error(compiler(loader), "@use 'theme' with ($color: blue);");
            assertEquals("This variable was not declared with !default in the @used module.",
                    error.getMessage());
        }

        @Test
        @DisplayName("模块 CSS 只输出一次且在使用者之前")
        void testModuleCssOnce() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.builder()
                    .add("base.scss", ".base { x: 1; }")
                    .add("a.scss", "@use 'base'; .a { y: 2; }")
                    .add("b.scss", "@use 'base'; .b { z: 3; }")
                    .build();
            CompileResult result = new SassCompiler(loader, CompileOptions.compressed())
                    .compile("@use 'a'; @use 'b'; .main { w: 4; }", "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertEquals(".base{x:1}.a{y:2}.b{z:3}.main{w:4}", result.getCss());
        }

        @Test
        @DisplayName("@forward 前缀")
        void testForwardPrefix() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.builder()
                    .add("_list.scss", "$gap: 2px; @mixin reset { margin: 0; }")
                    .add("_index.scss", "@forward 'list' as list-*;")
                    .build();
            CompileResult result = compiler(loader).compile(
                    "@use 'index'; a { g: index.$list-gap; @include index.list-reset; }", "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertEquals("a {\n  g: 2px;\n  margin: 0;\n}\n", result.getCss());
        }

        @Test
        @DisplayName("私有成员不可访问")
        void testPrivateMember() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("lib.scss", "$-secret: 1;");
            CompileResult result = compiler(loader).compile("@use 'lib'; a { b: lib.$-secret; }", "main.scss");
            assertFalse(result.isSuccess());
        }

        @Test
        @DisplayName("内置模块不能配置")
        void testBuiltinConfiguration() {
            assertEquals("Built-in modules can't be configured.",
                    error("@use 'sass:math' with ($pi: 3);").getMessage());
        }

        @Test
        @DisplayName("找不到模块")
        void testMissingModule() {
            assertEquals("Can't find stylesheet to import.", error("@use 'nowhere';").getMessage());
        }

        @Test
        @DisplayName("循环 @use 报错")
        void testUseCycle() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.builder()
                    .add("a.scss", "@use 'b';")
                    .add("b.scss", "@use 'a';")
                    .build();
            CompileResult result = compiler(loader).compile("@use 'a';", "main.scss");
            assertFalse(result.isSuccess());
        }

        @Test
        @DisplayName("旧式 @import 共享作用域")
        void testLegacyImport() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("_vars.scss", "$w: 5px;");
            CompileResult result = compiler(loader).compile("@import 'vars'; a { w: $w; }", "main.scss");
            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertEquals("a {\n  w: 5px;\n}\n", result.getCss());
        }

        @Test
        @DisplayName("禁用旧式 @import")
        void testLegacyImportDisabled() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.of("_vars.scss", "$w: 5px;");
            CompileOptions options = CompileOptions.builder().allowLegacyImport(false).build();
            Diagnostic error = error(new SassCompiler(loader, options), "@import 'vars';");
            assertEquals("@import is not allowed; use @use instead.", error.getMessage());
        }

        @Test
        @DisplayName("依赖中的警告可静默")
        void testQuietDeps() {
            InMemoryModuleLoader loader = InMemoryModuleLoader.builder()
                    .dependency("vendor.scss", "@warn \"from vendor\";")
                    .build();
            CompileOptions options = CompileOptions.builder().quietDeps(true).build();
            CompileResult result = new SassCompiler(loader, options).compile("@use 'vendor';", "main.scss");
            assertTrue(result.isSuccess());
            assertTrue(result.getDiagnostics().isEmpty());
        }
    }

    // ============ 接口 ============

    @Nested
    @DisplayName("编译接口")
    class ApiTests {

        @Test
        @DisplayName("语法错误转为失败结果")
        void testSyntaxError() {
            Diagnostic error = error("a { color: red");
            assertEquals(Diagnostic.Severity.ERROR, error.getSeverity());
            assertNotNull(error.getPrimarySpan());
        }

        @Test
        @DisplayName("compileOrThrow 抛出异常")
        void testCompileOrThrow() {
            SassCompiler compiler = new SassCompiler(EMPTY);
            assertThrows(SassRuntimeException.class, () -> compiler.compileOrThrow("a { b: $x; }", "main.scss"));
            assertEquals("a {\n  b: 1;\n}\n", compiler.compileOrThrow("a { b: 1; }", "main.scss"));
        }

        @Test
        @DisplayName("生成 source map")
        void testSourceMap() {
            CompileOptions options = CompileOptions.builder().sourceMap(true).build();
            CompileResult result = new SassCompiler(EMPTY, options).compile("a {\n  b: 1;\n}", "main.scss");
            assertTrue(result.isSuccess());
            assertNotNull(result.getSourceMap());
            assertTrue(result.getSourceMap().replace(" ", "").contains("\"version\":3"));
            assertFalse(result.getSourceMapEntries().isEmpty());
        }

        @Test
        @DisplayName("异步编译")
        void testCompileAsync() throws Exception {
            CompileResult result = new SassCompiler(EMPTY).compileAsync("a { b: 1; }", "main.scss")
                    .get(10, TimeUnit.SECONDS);
            assertEquals("a {\n  b: 1;\n}\n", result.getCss());
        }

        @Test
        @DisplayName("并发编译互不影响，结果与顺序编译一致")
        void testConcurrentCompilationsAreIsolated() throws Exception {
            int count = 24;
            List<String> sources = new ArrayList<>();
            List<String> expected = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String source = "%base { c: " + i + "; }\n"
                        + ".a-" + (i % 3) + " { @extend %base; r: random(1000); u: unique-id(); }\n"
                        + "@for $j from 1 through 3 { .x-#{$j} .y { w: random(); } }\n"
                        + ".card { &:hover { n: " + i + "; } }";
                sources.add(source);
                expected.add(compile(source, CompileOptions.builder().seed((long) i).build()));
            }

            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                for (int round = 0; round < 3; round++) {
                    List<CompletableFuture<CompileResult>> futures = new ArrayList<>();
                    for (int i = 0; i < count; i++) {
                        SassCompiler compiler = new SassCompiler(EMPTY, CompileOptions.builder().seed((long) i).build());
                        futures.add(compiler.compileAsync(sources.get(i), "main-" + i + ".scss", pool));
                    }
                    for (int i = 0; i < count; i++) {
                        CompileResult result = futures.get(i).get(30, TimeUnit.SECONDS);
                        assertTrue(result.isSuccess(), String.valueOf(result.getError()));
                        assertEquals(expected.get(i), result.getCss(), "compilation " + i);
                    }
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("空选项参数报错")
        void testNullOptions() {
            assertThrows(IllegalArgumentException.class, () -> new SassCompiler(EMPTY, null));
        }
    }
}
