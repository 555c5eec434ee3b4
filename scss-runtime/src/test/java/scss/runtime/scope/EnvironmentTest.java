package scss.runtime.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scss.runtime.UndefinedNameException;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassValue;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Environment 作用域规则测试
 */
class EnvironmentTest {

    private static SassValue n(double value) {
        return new SassNumber(value);
    }

    @Nested
    @DisplayName("变量查找与赋值")
    class VariableTests {

        @Test
        @DisplayName("内层帧可读外层变量")
        void testLookupThroughParents() {
            Environment root = new Environment();
            root.setVariable("x", n(1), false);
            Environment inner = root.child().child();
            assertEquals(n(1), inner.getVariable("x"));
            assertNull(inner.getVariable("missing"));
        }

        @Test
        @DisplayName("连字符与下划线等价")
        void testNameNormalization() {
            Environment root = new Environment();
            root.setVariable("main_width", n(10), false);
            assertEquals(n(10), root.getVariable("main-width"));
        }

        @Test
        @DisplayName("规则内对全局变量赋值创建局部变量")
        void testShadowInNonFlowScope() {
            Environment root = new Environment();
            root.setVariable("x", n(1), false);
            Environment rule = root.child();
            rule.setVariable("x", n(2), false);
            assertEquals(n(2), rule.getVariable("x"));
            assertEquals(n(1), root.getVariable("x"));
        }

        @Test
        @DisplayName("!global 写根帧")
        void testGlobalAssignment() {
            Environment root = new Environment();
            Environment inner = root.child().child();
            inner.setVariable("y", n(5), true);
            assertEquals(n(5), root.getVariable("y"));
            assertTrue(inner.globalVariableExists("y"));
        }

        @Test
        @DisplayName("根层控制流的帧是半全局的")
        void testSemiGlobalFlowControl() {
            Environment root = new Environment();
            root.setVariable("count", n(0), false);
            Environment loop = root.child(true);
            loop.setVariable("count", n(1), false);
            assertEquals(n(1), root.getVariable("count"));

            Environment nested = root.child().child(true);
            nested.setVariable("count", n(9), false);
            assertEquals(n(1), root.getVariable("count"));
        }

        @Test
        @DisplayName("内层已有的变量被原地修改")
        void testAssignExistingLocal() {
            Environment root = new Environment();
            Environment mixin = root.child();
            mixin.declareLocal("i", n(1));
            Environment block = mixin.child(true);
            block.setVariable("i", n(2), false);
            assertEquals(n(2), mixin.getVariable("i"));
            assertFalse(block.getLocalVariables().containsKey("i"));
        }
    }

    @Nested
    @DisplayName("模块绑定")
    class ModuleTests {

        @Test
        @DisplayName("未知命名空间报错")
        void testUnknownNamespace() {
            Environment root = new Environment();
            UndefinedNameException e = assertThrows(UndefinedNameException.class, () -> root.getModule("c"));
            assertEquals("There is no module with the namespace \"c\".", e.getMessage());
        }
    }
}
