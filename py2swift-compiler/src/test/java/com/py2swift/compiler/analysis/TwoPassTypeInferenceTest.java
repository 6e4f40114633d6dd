package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.DiagnosticSink;
import com.py2swift.compiler.lexer.Lexer;
import com.py2swift.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 两遍类型推断测试
 */
class TwoPassTypeInferenceTest {

    private DiagnosticSink diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticSink();
    }

    private InferenceResult infer(String source) {
        Module module = new Parser(new Lexer(source, "<test>"), "<test>").parse();
        return new TwoPassTypeInference().infer(module, diagnostics);
    }

    private String swift(SwiftType type) {
        return type == null ? null : type.toSwiftString();
    }

    // ================================================================
    // 签名收集
    // ================================================================

    @Nested
    @DisplayName("签名收集")
    class SignatureTests {

        @Test
        @DisplayName("注解映射为 Swift 类型")
        void testAnnotatedSignature() {
            InferenceResult result = infer("def f(a: int, b: str, c: List[float]) -> bool:\n    return True\n");
            FunctionSignature sig = result.getSignature("f");
            assertThat(swift(sig.getParamType("a"))).isEqualTo("Int");
            assertThat(swift(sig.getParamType("b"))).isEqualTo("String");
            assertThat(swift(sig.getParamType("c"))).isEqualTo("[Double]");
            assertThat(sig.isReturnAnnotated()).isTrue();
            assertThat(swift(sig.getReturnType())).isEqualTo("Bool");
        }

        @Test
        @DisplayName("-> None 映射为 Void")
        void testNoneReturn() {
            InferenceResult result = infer("def f() -> None:\n    pass\n");
            assertThat(result.getSignature("f").getReturnType().isVoid()).isTrue();
        }

        @Test
        @DisplayName("字典注解")
        void testDictAnnotation() {
            InferenceResult result = infer("def f(d: Dict[str, int]):\n    pass\n");
            assertThat(swift(result.getSignature("f").getParamType("d"))).isEqualTo("[String: Int]");
        }

        @Test
        @DisplayName("self 与 **kwargs 不进入签名，*args 为数组")
        void testReceiverAndVarargs() {
            InferenceResult result = infer(
                    "class A:\n    def m(self, *items: int, **opts):\n        pass\n");
            FunctionSignature sig = result.getSignature("m");
            assertThat(sig.hasParam("self")).isFalse();
            assertThat(sig.hasParam("opts")).isFalse();
            assertThat(swift(sig.getParamType("items"))).isEqualTo("[Int]");
        }

        @Test
        @DisplayName("无法映射的注解报告诊断")
        void testUnmappedAnnotation() {
            infer("def f(x: Widget) -> Optional[int]:\n    return x\n");
            assertThat(diagnostics.contains("Type annotation 'Widget' has no Swift mapping, using Any")).isTrue();
            assertThat(diagnostics.contains("Type annotation 'Optional[...]' has no Swift mapping, using Any")).isTrue();
        }

        @Test
        @DisplayName("Any 注解不报告")
        void testAnyAnnotationSilent() {
            infer("def f(x: Any):\n    pass\n");
            assertThat(diagnostics.isEmpty()).isTrue();
        }
    }

    // ================================================================
    // 类型传播
    // ================================================================

    @Nested
    @DisplayName("类型传播")
    class PropagationTests {

        @Test
        @DisplayName("字面量赋值记录变量类型")
        void testLiteralBindings() {
            InferenceResult result = infer("n = 5\nr = 2.5\ns = 'hi'\nok = True\nxs = [1, 2, 3]\nm = {'a': 1}\n");
            assertThat(result.getVarType("n")).isEqualTo(SwiftTypes.INT);
            assertThat(result.getVarType("r")).isEqualTo(SwiftTypes.DOUBLE);
            assertThat(result.getVarType("s")).isEqualTo(SwiftTypes.STRING);
            assertThat(result.getVarType("ok")).isEqualTo(SwiftTypes.BOOL);
            assertThat(swift(result.getVarType("xs"))).isEqualTo("[Int]");
            assertThat(swift(result.getVarType("m"))).isEqualTo("[String: Int]");
        }

        @Test
        @DisplayName("首次绑定的类型保持不变")
        void testFirstBindingWins() {
            InferenceResult result = infer("x = 1\nx = 'later'\n");
            assertThat(result.getVarType("x")).isEqualTo(SwiftTypes.INT);
        }

        @Test
        @DisplayName("Int 与 Double 混合运算提升为 Double")
        void testNumericPromotion() {
            InferenceResult result = infer("a = 1\nb = 2.0\nc = a + b\nd = a / a\ne = a // 2\n");
            assertThat(result.getVarType("c")).isEqualTo(SwiftTypes.DOUBLE);
            assertThat(result.getVarType("d")).isEqualTo(SwiftTypes.DOUBLE);
            assertThat(result.getVarType("e")).isEqualTo(SwiftTypes.INT);
        }

        @Test
        @DisplayName("for 循环变量取元素类型")
        void testLoopVariable() {
            InferenceResult result = infer("for i in range(10):\n    pass\nfor ch in 'abc':\n    pass\n");
            assertThat(result.getVarType("i")).isEqualTo(SwiftTypes.INT);
            assertThat(result.getVarType("ch")).isEqualTo(SwiftTypes.STRING);
        }

        @Test
        @DisplayName("元组解包逐元素绑定")
        void testTupleBinding() {
            InferenceResult result = infer("a, b = 1, 'x'\n");
            assertThat(result.getVarType("a")).isEqualTo(SwiftTypes.INT);
            assertThat(result.getVarType("b")).isEqualTo(SwiftTypes.STRING);
        }

        @Test
        @DisplayName("__init__ 中的 self 属性")
        void testInstanceAttributes() {
            InferenceResult result = infer(
                    "class Counter:\n    def __init__(self, name: str):\n        self.name = name\n        self.count = 0\n");
            assertThat(result.getInstanceAttributes("Counter"))
                    .containsEntry("name", SwiftTypes.STRING)
                    .containsEntry("count", SwiftTypes.INT);
        }
    }

    // ================================================================
    // 参数细化与返回类型
    // ================================================================

    @Nested
    @DisplayName("参数细化与返回类型")
    class RefinementTests {

        @Test
        @DisplayName("参与整数算术的参数细化为 Int")
        void testArithmeticRefinement() {
            InferenceResult result = infer("def square(x):\n    return x * x\n");
            FunctionSignature sig = result.getSignature("square");
            assertThat(sig.getParamType("x")).isEqualTo(SwiftTypes.INT);
            assertThat(sig.getReturnType()).isEqualTo(SwiftTypes.INT);
        }

        @Test
        @DisplayName("与浮点数比较的参数细化为 Double")
        void testComparisonRefinement() {
            InferenceResult result = infer("def pos(x):\n    return x > 0.5\n");
            FunctionSignature sig = result.getSignature("pos");
            assertThat(sig.getParamType("x")).isEqualTo(SwiftTypes.DOUBLE);
            assertThat(sig.getReturnType()).isEqualTo(SwiftTypes.BOOL);
        }

        @Test
        @DisplayName("未使用的参数保持 Any")
        void testUnusedParameter() {
            InferenceResult result = infer("def show(x):\n    print(x)\n");
            FunctionSignature sig = result.getSignature("show");
            assertThat(sig.getParamType("x").isAny()).isTrue();
            assertThat(sig.getReturnType().isVoid()).isTrue();
        }

        @Test
        @DisplayName("Int 与 Double 返回值提升为 Double")
        void testMixedReturns() {
            InferenceResult result = infer("def f(flag: bool):\n    if flag:\n        return 1\n    return 2.5\n");
            assertThat(result.getSignature("f").getReturnType()).isEqualTo(SwiftTypes.DOUBLE);
        }

        @Test
        @DisplayName("函数体中无关的 / 不影响 Int 返回值")
        void testUnrelatedDivision() {
            InferenceResult result = infer("def f(a: int, b: int):\n    ratio = a / b\n    print(ratio)\n    return a + b\n");
            assertThat(result.getSignature("f").getReturnType()).isEqualTo(SwiftTypes.INT);
            assertThat(result.getVarType("ratio")).isEqualTo(SwiftTypes.DOUBLE);
        }

        @Test
        @DisplayName("默认值与 *args 记录在签名中")
        void testDefaultsAndVariadic() {
            InferenceResult result = infer("def f(a, b=1, *rest):\n    pass\n");
            FunctionSignature sig = result.getSignature("f");
            assertThat(sig.getDefault("a")).isNull();
            assertThat(sig.getDefault("b")).isNotNull();
            assertThat(sig.getVariadic()).isEqualTo("rest");
        }

        @Test
        @DisplayName("类型不一致的返回值为 Any")
        void testConflictingReturns() {
            InferenceResult result = infer("def f(flag: bool):\n    if flag:\n        return 1\n    return 'no'\n");
            assertThat(result.getSignature("f").getReturnType().isAny()).isTrue();
        }

        @Test
        @DisplayName("return None 不参与推断")
        void testReturnNoneIgnored() {
            InferenceResult result = infer("def f():\n    return None\n");
            assertThat(result.getSignature("f").getReturnType().isVoid()).isTrue();
        }

        @Test
        @DisplayName("调用已推断的函数")
        void testCallUsesSignature() {
            InferenceResult result = infer("def one():\n    return 1\nv = one()\n");
            assertThat(result.getVarType("v")).isEqualTo(SwiftTypes.INT);
        }
    }
}
