package com.py2swift.compiler.codegen;

import com.py2swift.compiler.analysis.InferenceResult;
import com.py2swift.compiler.analysis.ScopeManager;
import com.py2swift.compiler.analysis.TwoPassTypeInference;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.Diagnostic;
import com.py2swift.compiler.diagnostic.DiagnosticSink;
import com.py2swift.compiler.frontend.SourceFrontEnd;
import com.py2swift.compiler.transpiler.TranspilerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Swift 代码生成测试（不输出文件头与诊断注释，便于逐行比较）
 */
class SwiftCodeGeneratorTest {

    private DiagnosticSink diagnostics;
    private SwiftCodeGenerator generator;

    private String generate(String source) {
        TranspilerConfig config = new TranspilerConfig();
        config.setEmitHeader(false);
        config.setEmitDiagnosticsBlock(false);
        diagnostics = new DiagnosticSink();
        Module module = new SourceFrontEnd("<test>").parse(source, diagnostics);
        InferenceResult types = new TwoPassTypeInference().infer(module, diagnostics);
        generator = new SwiftCodeGenerator(types, diagnostics, config);
        return generator.generate(module);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    // ================================================================
    // 变量声明
    // ================================================================

    @Nested
    @DisplayName("变量声明")
    class DeclarationTests {

        @Test
        @DisplayName("只绑定一次的字面量用 let")
        void testLetForLiteral() {
            assertThat(generate("x = 1\ny = 2.5\ns = 'hi'\n")).isEqualTo(lines(
                    "let x: Int = 1",
                    "let y: Double = 2.5",
                    "let s: String = \"hi\""));
        }

        @Test
        @DisplayName("被重新绑定的名称用 var，后续为普通赋值")
        void testVarForRebound() {
            assertThat(generate("count = 0\ncount += 1\n")).isEqualTo(lines(
                    "var count: Int = 0",
                    "count += 1"));
        }

        @Test
        @DisplayName("非字面量初值用 var")
        void testVarForExpression() {
            assertThat(generate("xs = [1, 2, 3]\nn = len(xs)\n")).isEqualTo(lines(
                    "var xs: [Int] = [1, 2, 3]",
                    "var n: Int = xs.count"));
        }

        @Test
        @DisplayName("None 初值声明为可选类型")
        void testNoneInitializer() {
            String out = generate("x = None\nif x is None:\n    print(1)\n");
            assertThat(out).contains("var x: Any? = nil\n");
            assertThat(out).contains("if x == nil {\n");
        }

        @Test
        @DisplayName("带注解的赋值使用注解类型")
        void testAnnotatedAssign() {
            String out = generate("total: float = 0\nlabel: str\n");
            assertThat(out).contains("let total: Double = 0\n");
            assertThat(out).contains("var label: String\n");
        }

        @Test
        @DisplayName("Swift 保留字加反引号")
        void testKeywordEscaping() {
            assertThat(generate("default = 3\n")).isEqualTo(lines("let `default`: Int = 3"));
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscaping() {
            assertThat(generate("s = \"a\\\"b\\n\"\n")).isEqualTo(lines("let s: String = \"a\\\"b\\n\""));
        }

        @Test
        @DisplayName("反斜杠只转义一次")
        void testBackslashEscapedOnce() {
            assertThat(generate("s = 'a\\\\b'\n")).isEqualTo(lines("let s: String = \"a\\\\b\""));
            assertThat(generate("p = r'C:\\dir'\n")).isEqualTo(lines("let p: String = \"C:\\\\dir\""));
            assertThat(generate("t = '\\\\\\\\'\n")).isEqualTo(lines("let t: String = \"\\\\\\\\\""));
        }

        @Test
        @DisplayName("链式赋值复用常量")
        void testChainedAssign() {
            assertThat(generate("a = b = 0\n")).isEqualTo(lines(
                    "let a: Int = 0",
                    "let b: Int = 0"));
        }
    }

    // ================================================================
    // 元组赋值
    // ================================================================

    @Nested
    @DisplayName("元组赋值")
    class TupleAssignTests {

        @Test
        @DisplayName("同一数组的下标交换输出 swapAt")
        void testSwapAt() {
            String out = generate(
                    "def bubble(arr):\n"
                    + "    n = len(arr)\n"
                    + "    for i in range(n):\n"
                    + "        for j in range(0, n - i - 1):\n"
                    + "            if arr[j] > arr[j + 1]:\n"
                    + "                arr[j], arr[j + 1] = arr[j + 1], arr[j]\n"
                    + "    return arr\n");
            assertThat(out).contains("arr.swapAt(j, j + 1)");
            assertThat(out).contains("for j in 0..<n - i - 1 {");
        }

        @Test
        @DisplayName("不同容器之间不视为交换")
        void testDifferentContainers() {
            String out = generate("a = [1, 2]\nb = [3, 4]\na[0], b[1] = b[1], a[0]\n");
            assertThat(out).doesNotContain("swapAt");
            assertThat(out).contains("a[0] = b[1]\n");
            assertThat(out).contains("b[1] = a[0]\n");
        }

        @Test
        @DisplayName("右侧读取左侧名称时整体赋值")
        void testSimultaneousAssign() {
            assertThat(generate("a = 1\nb = 2\na, b = b, a\n")).isEqualTo(lines(
                    "var a: Int = 1",
                    "var b: Int = 2",
                    "(a, b) = (b, a)"));
        }

        @Test
        @DisplayName("互不相关的元组逐个赋值")
        void testElementWise() {
            assertThat(generate("a, b = 1, 'x'\n")).isEqualTo(lines(
                    "let a: Int = 1",
                    "let b: String = \"x\""));
        }

        @Test
        @DisplayName("从非元组值解包报告诊断")
        void testNonTupleUnpack() {
            String out = generate("pair = (1, 2)\nx, y = pair\n");
            assertThat(out).contains("var (x, y) = pair\n");
            assertThat(diagnostics.contains("Tuple unpacking from a non-tuple value may not work")).isTrue();
        }
    }

    // ================================================================
    // 表达式翻译
    // ================================================================

    @Nested
    @DisplayName("表达式翻译")
    class ExpressionTests {

        @Test
        @DisplayName("Int 与 Double 混合运算")
        void testNumericPromotion() {
            String out = generate("x = 1\ny = 2.5\nz = x + y\n");
            assertThat(out).contains("var z: Double = Double(x) + y\n");
        }

        @Test
        @DisplayName("整除、真除与幂")
        void testDivisionAndPower() {
            String out = generate("a = 7\nb = a // 2\nc = a / 2\nd = a ** 2\n");
            assertThat(out).contains("var b: Int = Int(Double(a) / Double(2))\n");
            assertThat(out).contains("var c: Double = Double(a) / 2\n");
            assertThat(out).contains("var d: Double = pow(Double(a), 2)\n");
        }

        @Test
        @DisplayName("负下标改写为 count - n")
        void testNegativeIndex() {
            String out = generate("xs = [1, 2]\ny = xs[-1]\n");
            assertThat(out).contains("var y: Int = xs[xs.count - 1]\n");
        }

        @Test
        @DisplayName("字典的负数键保持原样")
        void testNegativeDictionaryKey() {
            String out = generate("d = {-1: 'a', 0: 'b'}\nprint(d[-1])\n");
            assertThat(out).contains("print(d[-1]!)\n");
            assertThat(out).doesNotContain("d.count");
        }

        @Test
        @DisplayName("未知方法的接收者只生成一次")
        void testPassthroughReceiverDiagnosedOnce() {
            generate("xs = [1, 2, 3, 4]\nxs[::2].frobnicate()\n");
            assertThat(diagnostics.getDiagnostics())
                    .filteredOn(d -> d.getMessage().startsWith("Slice with step other than -1"))
                    .hasSize(1);
        }

        @Test
        @DisplayName("字符串下标与反转")
        void testStringIndexing() {
            String out = generate("s = 'hello'\nc = s[0]\nr = s[::-1]\n");
            assertThat(out).contains("var c: String = String(Array(s)[0])\n");
            assertThat(out).contains("var r: String = String(s.reversed())\n");
        }

        @Test
        @DisplayName("推导式翻译为 filter / map 链")
        void testComprehension() {
            String out = generate("nums = [1, 2, 3]\nevens = [n * 2 for n in nums if n % 2 == 0]\n");
            assertThat(out).contains("nums.filter { $0 % 2 == 0 }.map { $0 * 2 }");
        }

        @Test
        @DisplayName("恒等推导式直接复用序列")
        void testIdentityComprehension() {
            String out = generate("nums = [1, 2, 3]\ncopy = [x for x in nums]\n");
            assertThat(out).contains("= nums\n");
            assertThat(out).doesNotContain(".map");
        }

        @Test
        @DisplayName("成员测试与 any")
        void testMembership() {
            String out = generate("xs = [1, 2]\nif 1 in xs:\n    pass\nok = any(x > 1 for x in xs)\n");
            assertThat(out).contains("if xs.contains(1) {\n    // pass\n}\n");
            assertThat(out).contains("xs.contains(where: { $0 > 1 })");
        }

        @Test
        @DisplayName("容器与数值的真值条件")
        void testTruthiness() {
            String out = generate("xs = [1]\nn = 3\nif xs:\n    pass\nwhile n:\n    n -= 1\n");
            assertThat(out).contains("if !xs.isEmpty {");
            assertThat(out).contains("while n != 0 {");
        }

        @Test
        @DisplayName("f-string 转为字符串插值")
        void testFString() {
            String out = generate("name = 'x'\nprint(f'hi {name}!')\n");
            assertThat(out).contains("print(\"hi \\(name)!\")\n");
        }

        @Test
        @DisplayName("print 的 sep 与 end")
        void testPrintKeywords() {
            String out = generate("print(1, 2, end='', sep='-')\n");
            assertThat(out).isEqualTo(lines("print(1, 2, separator: \"-\", terminator: \"\")"));
        }
    }

    // ================================================================
    // 控制流
    // ================================================================

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("range 的三种形式")
        void testRangeForms() {
            assertThat(generate("for i in range(5):\n    print(i)\n")).isEqualTo(lines(
                    "for i in 0..<5 {",
                    "    print(i)",
                    "}"));
            assertThat(generate("for i in range(2, 5):\n    pass\n")).contains("for i in 2..<5 {");
            assertThat(generate("for i in range(0, 10, 2):\n    pass\n"))
                    .contains("for i in stride(from: 0, to: 10, by: 2) {");
        }

        @Test
        @DisplayName("if / elif / else 展平")
        void testElifChain() {
            String out = generate("x = 5\nif x > 3:\n    print(1)\nelif x > 1:\n    print(2)\nelse:\n    print(3)\n");
            assertThat(out).contains(lines(
                    "if x > 3 {",
                    "    print(1)",
                    "} else if x > 1 {",
                    "    print(2)",
                    "} else {",
                    "    print(3)",
                    "}"));
        }

        @Test
        @DisplayName("__main__ 守卫内联到顶层")
        void testMainGuardInlined() {
            String out = generate("def main():\n    print('hi')\n\nif __name__ == '__main__':\n    main()\n");
            assertThat(out).isEqualTo(lines(
                    "func main() {",
                    "    print(\"hi\")",
                    "}",
                    "",
                    "main()"));
        }

        @Test
        @DisplayName("while-else 的 else 分支被注释")
        void testWhileElse() {
            String out = generate("while False:\n    pass\nelse:\n    y = 1\n");
            assertThat(out).contains("while false {\n");
            assertThat(out).contains("// while-else original:\n");
            assertThat(diagnostics.contains("while-else has no direct equivalent in Swift")).isTrue();
        }

        @Test
        @DisplayName("for-else 报告诊断")
        void testForElse() {
            generate("for i in range(3):\n    pass\nelse:\n    pass\n");
            assertThat(diagnostics.contains("for-else has no direct equivalent in Swift")).isTrue();
        }
    }

    // ================================================================
    // 函数与类
    // ================================================================

    @Nested
    @DisplayName("函数与类")
    class DefinitionTests {

        @Test
        @DisplayName("注解函数签名")
        void testAnnotatedFunction() {
            String out = generate("def add(a: int, b: int) -> int:\n    return a + b\n");
            assertThat(out).contains(lines(
                    "func add(_ a: Int, _ b: Int) -> Int {",
                    "    return a + b",
                    "}"));
        }

        @Test
        @DisplayName("无注解参数按用法推断")
        void testInferredFunction() {
            String out = generate("def square(x):\n    return x * x\n");
            assertThat(out).contains("func square(_ x: Int) -> Int {\n");
        }

        @Test
        @DisplayName("函数体内重新绑定的参数复制为 var")
        void testReboundParameter() {
            String out = generate("def f(n):\n    n = n + 1\n    return n\n");
            assertThat(out).contains(lines(
                    "func f(_ n: Int) -> Int {",
                    "    var n = n",
                    "    n = n + 1",
                    "    return n",
                    "}"));
        }

        @Test
        @DisplayName("默认值 None 的参数为可选类型")
        void testOptionalParameter() {
            String out = generate("def greet(name=None):\n    pass\n");
            assertThat(out).contains("func greet(_ name: Any? = nil) {\n");
        }

        @Test
        @DisplayName("仅关键字参数带标签")
        void testKeywordOnlyParameter() {
            String out = generate("def f(a: int, *, scale: int = 2) -> int:\n    return a * scale\nv = f(1, scale=3)\n");
            assertThat(out).contains("func f(_ a: Int, scale: Int = 2) -> Int {\n");
            assertThat(out).contains("f(1, scale: 3)");
        }

        @Test
        @DisplayName("关键字参数跳过的默认参数按默认值补齐")
        void testSkippedDefaultFilled() {
            String out = generate("def f(a, b=1, c=2):\n    return a + b + c\nprint(f(1, c=5))\nprint(f(c=7, a=3))\n");
            assertThat(out).contains("print(f(1, 1, 5))\n");
            assertThat(out).contains("print(f(3, 1, 7))\n");
            assertThat(diagnostics.contains("in call to f")).isFalse();
        }

        @Test
        @DisplayName("缺少无默认值的参数时报告诊断")
        void testSkippedRequiredReported() {
            generate("def g(a, b, c=0):\n    return a\nv = g(1, c=2)\n");
            assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::getMessage)
                    .contains("Missing argument 'b' in call to g");
        }

        @Test
        @DisplayName("函数体中无关的 / 不影响 Int 返回类型")
        void testUnrelatedDivisionKeepsIntReturn() {
            String out = generate("def f(a: int, b: int):\n    ratio = a / b\n    print(ratio)\n    return a + b\n");
            assertThat(out).contains("func f(_ a: Int, _ b: Int) -> Int {\n");
        }

        @Test
        @DisplayName("文档字符串转为注释")
        void testDocstring() {
            String out = generate("def f():\n    \"\"\"Say hi.\"\"\"\n    print('hi')\n");
            assertThat(out).contains("func f() {\n    // Say hi.\n    print(\"hi\")\n}\n");
        }

        @Test
        @DisplayName("类：实例属性、init 与方法")
        void testClass() {
            String out = generate(
                    "class Point:\n"
                    + "    def __init__(self, x, y):\n"
                    + "        self.x = x\n"
                    + "        self.y = y\n"
                    + "\n"
                    + "    def describe(self):\n"
                    + "        return 'Point'\n");
            assertThat(out).contains(lines(
                    "class Point {",
                    "    var x: Any",
                    "    var y: Any",
                    "",
                    "    init(_ x: Any, _ y: Any) {",
                    "        self.x = x",
                    "        self.y = y",
                    "    }",
                    "",
                    "    func describe() -> String {",
                    "        return \"Point\"",
                    "    }",
                    "}"));
        }

        @Test
        @DisplayName("类级赋值为 static var，基类 object 被省略")
        void testClassAttributes() {
            String out = generate("class Config(object):\n    debug = False\n");
            assertThat(out).contains("class Config {\n    static var debug: Bool = false\n}\n");
        }

        @Test
        @DisplayName("静态方法与未知装饰器")
        void testDecorators() {
            String out = generate(
                    "class M:\n    @staticmethod\n    def twice(v: int) -> int:\n        return v * 2\n"
                    + "    @cached\n    def other(self):\n        pass\n");
            assertThat(out).contains("static func twice(_ v: Int) -> Int {");
            assertThat(diagnostics.contains("Decorator '@cached' ignored")).isTrue();
        }

        @Test
        @DisplayName("**kwargs 被丢弃")
        void testKwargsDropped() {
            String out = generate("def f(a: int, **opts):\n    pass\n");
            assertThat(out).contains("func f(_ a: Int) {");
            assertThat(diagnostics.contains("**kwargs parameter 'opts' not supported, dropped")).isTrue();
        }
    }

    // ================================================================
    // 异常与其他语句
    // ================================================================

    @Nested
    @DisplayName("异常与其他语句")
    class OtherStatementTests {

        @Test
        @DisplayName("int(input()) 的 try 改写为 if let")
        void testInputIdiom() {
            String out = generate(
                    "try:\n    n = int(input('Enter: '))\n    print(n * 2)\nexcept ValueError:\n    print('bad')\n");
            assertThat(out).isEqualTo(lines(
                    "print(\"Enter: \", terminator: \"\")",
                    "if let line = readLine(), let n = Int(line) {",
                    "    print(n * 2)",
                    "} else {",
                    "    print(\"bad\")",
                    "}"));
        }

        @Test
        @DisplayName("try / except / finally 转为 do / catch")
        void testDoCatch() {
            String out = generate(
                    "try:\n    risky()\nexcept ValueError as e:\n    print(e)\n"
                    + "except Exception as err:\n    print(err)\nfinally:\n    print('done')\n");
            assertThat(out).contains(lines(
                    "do {",
                    "    risky()",
                    "} catch let e as ValueError {",
                    "    print(e)",
                    "} catch {",
                    "    let err = error",
                    "    print(err)",
                    "}",
                    "print(\"done\")"));
        }

        @Test
        @DisplayName("raise 被注释")
        void testRaise() {
            String out = generate("raise ValueError('bad')\n");
            assertThat(out).isEqualTo(lines("// raise ValueError(\"bad\")"));
            assertThat(diagnostics.contains("raise not supported, statement commented out")).isTrue();
        }

        @Test
        @DisplayName("with 保留语句体")
        void testWith() {
            String out = generate("with open('f') as fh:\n    data = fh.read()\n");
            assertThat(out).isEqualTo(lines(
                    "do {",
                    "    let fh = open(\"f\")",
                    "    var data = fh.read()",
                    "}"));
            assertThat(diagnostics.contains("with statement not supported, context manager dropped")).isTrue();
        }

        @Test
        @DisplayName("del 字典键与数组元素")
        void testDelete() {
            String out = generate("d = {'a': 1}\nxs = [1, 2]\ndel d['a']\ndel xs[0]\n");
            assertThat(out).contains("d.removeValue(forKey: \"a\")\n");
            assertThat(out).contains("xs.remove(at: 0)\n");
        }

        @Test
        @DisplayName("import 映射")
        void testImports() {
            assertThat(generate("import math\nimport numpy\nfrom collections import deque\n")).isEqualTo(lines(
                    "import Foundation",
                    "// import numpy  // manual mapping required",
                    "// from collections import deque  // map manually"));
        }

        @Test
        @DisplayName("assert")
        void testAssert() {
            assertThat(generate("x = 1\nassert x > 0, 'positive'\n"))
                    .contains("assert(x > 0, \"positive\")\n");
        }

        @Test
        @DisplayName("yield 报告诊断")
        void testYield() {
            generate("def gen():\n    yield 1\n");
            assertThat(diagnostics.contains("yield not supported")).isTrue();
            assertThat(diagnostics.contains("Unsupported expression: Yield")).isTrue();
        }
    }

    // ================================================================
    // 作用域
    // ================================================================

    @Nested
    @DisplayName("作用域")
    class ScopeTests {

        @Test
        @DisplayName("生成结束后只剩 global 帧")
        void testScopesUnwound() {
            generate("g = 1\ndef f():\n    local = 2\n    return local\nclass C:\n    k = 1\n");
            ScopeManager scopes = generator.getScopes();
            assertThat(scopes.depth()).isEqualTo(1);
            assertThat(scopes.lookup("g")).isNotNull();
            assertThat(scopes.lookup("local")).isNull();
            assertThat(scopes.lookup("k")).isNull();
        }

        @Test
        @DisplayName("函数内的同名变量重新声明")
        void testFunctionLocalShadowsGlobal() {
            String out = generate("x = 1\ndef f():\n    x = 2\n    return x\n");
            assertThat(out).contains("let x: Int = 1\n");
            assertThat(out).contains("    let x: Int = 2\n");
        }

        @Test
        @DisplayName("global 声明后为普通赋值")
        void testGlobalAssignment() {
            String out = generate("counter = 0\ndef bump():\n    global counter\n    counter = counter + 1\n");
            assertThat(out).contains("var counter: Int = 0\n");
            assertThat(out).contains("    counter = counter + 1\n");
        }
    }
}
