package com.py2swift.compiler.parser;

import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Module parse(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parse();
    }

    private Statement single(String source) {
        List<Statement> body = parse(source).getBody();
        assertThat(body).hasSize(1);
        return body.get(0);
    }

    private Expression expr(String source) {
        Statement stmt = single(source);
        assertThat(stmt).isInstanceOf(ExpressionStmt.class);
        return ((ExpressionStmt) stmt).getValue();
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3\n");
            assertThat(add.getOperator()).isEqualTo(BinaryExpr.Operator.ADD);
            assertThat(add.getRight()).isInstanceOf(BinaryExpr.class);
            assertThat(((BinaryExpr) add.getRight()).getOperator()).isEqualTo(BinaryExpr.Operator.MULT);
        }

        @Test
        @DisplayName("幂运算右结合且高于一元负号")
        void testPower() {
            UnaryExpr neg = (UnaryExpr) expr("-2 ** 3 ** 2\n");
            assertThat(neg.getOperator()).isEqualTo(UnaryExpr.Operator.NEGATE);
            BinaryExpr pow = (BinaryExpr) neg.getOperand();
            assertThat(pow.getOperator()).isEqualTo(BinaryExpr.Operator.POW);
            assertThat(pow.getRight()).isInstanceOf(BinaryExpr.class);
        }

        @Test
        @DisplayName("链式比较")
        void testChainedComparison() {
            CompareExpr cmp = (CompareExpr) expr("0 < x <= 10\n");
            assertThat(cmp.getOperators()).containsExactly(CompareExpr.Operator.LT, CompareExpr.Operator.LT_E);
            assertThat(cmp.getComparators()).hasSize(2);
        }

        @Test
        @DisplayName("is not / not in")
        void testNegatedOperators() {
            CompareExpr isNot = (CompareExpr) expr("a is not None\n");
            assertThat(isNot.getOperators()).containsExactly(CompareExpr.Operator.IS_NOT);
            CompareExpr notIn = (CompareExpr) expr("a not in b\n");
            assertThat(notIn.getOperators()).containsExactly(CompareExpr.Operator.NOT_IN);
        }

        @Test
        @DisplayName("and 优先于 or")
        void testBoolOps() {
            BoolOpExpr or = (BoolOpExpr) expr("a or b and c\n");
            assertThat(or.getOperator()).isEqualTo(BoolOpExpr.Operator.OR);
            assertThat(or.getValues().get(1)).isInstanceOf(BoolOpExpr.class);
        }

        @Test
        @DisplayName("条件表达式")
        void testConditional() {
            ConditionalExpr cond = (ConditionalExpr) expr("a if c else b\n");
            assertThat(((NameExpr) cond.getTest()).getId()).isEqualTo("c");
            assertThat(((NameExpr) cond.getBody()).getId()).isEqualTo("a");
            assertThat(((NameExpr) cond.getOrElse()).getId()).isEqualTo("b");
        }

        @Test
        @DisplayName("列表推导式带过滤条件")
        void testListComprehension() {
            ListCompExpr comp = (ListCompExpr) expr("[x * 2 for x in xs if x > 0]\n");
            assertThat(comp.getElement()).isInstanceOf(BinaryExpr.class);
            assertThat(comp.getGenerators()).hasSize(1);
            Comprehension gen = comp.getGenerators().get(0);
            assertThat(((NameExpr) gen.getTarget()).getId()).isEqualTo("x");
            assertThat(gen.getIfs()).hasSize(1);
        }

        @Test
        @DisplayName("切片")
        void testSlice() {
            SubscriptExpr sub = (SubscriptExpr) expr("s[::-1]\n");
            SliceExpr slice = (SliceExpr) sub.getIndex();
            assertThat(slice.getLower()).isNull();
            assertThat(slice.getUpper()).isNull();
            assertThat(slice.getStep()).isInstanceOf(UnaryExpr.class);
        }

        @Test
        @DisplayName("关键字参数")
        void testKeywordArguments() {
            CallExpr call = (CallExpr) expr("print(a, b, sep=', ')\n");
            assertThat(call.getArgs()).hasSize(2);
            assertThat(call.keyword("sep")).isInstanceOf(ConstantExpr.class);
            assertThat(call.keyword("end")).isNull();
        }

        @Test
        @DisplayName("lambda")
        void testLambda() {
            LambdaExpr lambda = (LambdaExpr) expr("lambda a, b: a + b\n");
            assertThat(lambda.getParameters()).extracting(Parameter::getName).containsExactly("a", "b");
            assertThat(lambda.getBody()).isInstanceOf(BinaryExpr.class);
        }

        @Test
        @DisplayName("f-string 拆分为字面量与插值")
        void testFString() {
            JoinedStrExpr joined = (JoinedStrExpr) expr("f'x={x + 1}!'\n");
            assertThat(joined.getValues()).hasSize(3);
            assertThat(joined.getValues().get(1)).isInstanceOf(FormattedValueExpr.class);
            FormattedValueExpr value = (FormattedValueExpr) joined.getValues().get(1);
            assertThat(value.getValue()).isInstanceOf(BinaryExpr.class);
        }

        @Test
        @DisplayName("整数常量值")
        void testIntConstant() {
            ConstantExpr c = (ConstantExpr) expr("42\n");
            assertThat(c.getKind()).isEqualTo(ConstantExpr.Kind.INT);
            assertThat(c.getValue()).isEqualTo(BigInteger.valueOf(42));
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("链式赋值保留全部目标")
        void testChainedAssign() {
            AssignStmt assign = (AssignStmt) single("a = b = 0\n");
            assertThat(assign.getTargets()).hasSize(2);
            assertThat(assign.getValue()).isInstanceOf(ConstantExpr.class);
        }

        @Test
        @DisplayName("元组解包赋值")
        void testTupleAssign() {
            AssignStmt assign = (AssignStmt) single("a, b = b, a\n");
            assertThat(assign.getTargets().get(0)).isInstanceOf(TupleExpr.class);
            assertThat(assign.getValue()).isInstanceOf(TupleExpr.class);
        }

        @Test
        @DisplayName("带注解赋值与增强赋值")
        void testAnnotatedAndAugmented() {
            List<Statement> body = parse("x: int = 1\nx += 2\n").getBody();
            assertThat(body.get(0)).isInstanceOf(AnnAssignStmt.class);
            AugAssignStmt aug = (AugAssignStmt) body.get(1);
            assertThat(aug.getOperator()).isEqualTo(BinaryExpr.Operator.ADD);
        }

        @Test
        @DisplayName("函数定义：注解、默认值、*args、**kwargs")
        void testFunctionDef() {
            FunctionDefStmt def = (FunctionDefStmt) single(
                    "def f(a: int, b=2, *rest, key=None, **opts) -> str:\n    return 'x'\n");
            assertThat(def.getName()).isEqualTo("f");
            assertThat(def.getParameters()).extracting(Parameter::getKind).containsExactly(
                    Parameter.Kind.POSITIONAL, Parameter.Kind.POSITIONAL, Parameter.Kind.VARARG,
                    Parameter.Kind.KEYWORD_ONLY, Parameter.Kind.KWARG);
            assertThat(def.getParameters().get(0).getAnnotation()).isInstanceOf(NameExpr.class);
            assertThat(def.getParameters().get(1).getDefaultValue()).isInstanceOf(ConstantExpr.class);
            assertThat(((NameExpr) def.getReturns()).getId()).isEqualTo("str");
            assertThat(def.getBody().get(0)).isInstanceOf(ReturnStmt.class);
        }

        @Test
        @DisplayName("装饰器")
        void testDecorators() {
            Module module = parse("class A:\n    @staticmethod\n    def f():\n        pass\n");
            ClassDefStmt cls = (ClassDefStmt) module.getBody().get(0);
            FunctionDefStmt def = (FunctionDefStmt) cls.getBody().get(0);
            assertThat(def.hasDecorator("staticmethod")).isTrue();
            assertThat(def.hasDecorator("property")).isFalse();
        }

        @Test
        @DisplayName("elif 展开为嵌套 if")
        void testElif() {
            IfStmt stmt = (IfStmt) single("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n");
            assertThat(stmt.getOrElse()).hasSize(1);
            IfStmt elif = (IfStmt) stmt.getOrElse().get(0);
            assertThat(((NameExpr) elif.getTest()).getId()).isEqualTo("b");
            assertThat(elif.getOrElse()).hasSize(1);
        }

        @Test
        @DisplayName("for-else 与 while")
        void testLoops() {
            ForStmt loop = (ForStmt) single("for i in range(3):\n    pass\nelse:\n    pass\n");
            assertThat(loop.getIter()).isInstanceOf(CallExpr.class);
            assertThat(loop.getOrElse()).hasSize(1);
            WhileStmt w = (WhileStmt) single("while True:\n    break\n");
            assertThat(w.getBody().get(0)).isInstanceOf(BreakStmt.class);
        }

        @Test
        @DisplayName("try / except / else / finally")
        void testTry() {
            TryStmt stmt = (TryStmt) single(
                    "try:\n    x = 1\nexcept ValueError as e:\n    pass\nexcept:\n    pass\n"
                    + "else:\n    y = 2\nfinally:\n    z = 3\n");
            assertThat(stmt.getHandlers()).hasSize(2);
            assertThat(stmt.getHandlers().get(0).getName()).isEqualTo("e");
            assertThat(stmt.getHandlers().get(1).isCatchAll()).isTrue();
            assertThat(stmt.getOrElse()).hasSize(1);
            assertThat(stmt.getFinalBody()).hasSize(1);
        }

        @Test
        @DisplayName("import 与 from import")
        void testImports() {
            List<Statement> body = parse("import math as m\nfrom os import path, sep\n").getBody();
            ImportStmt imp = (ImportStmt) body.get(0);
            assertThat(imp.getNames().get(0).getName()).isEqualTo("math");
            assertThat(imp.getNames().get(0).getAsName()).isEqualTo("m");
            ImportFromStmt from = (ImportFromStmt) body.get(1);
            assertThat(from.getModule()).isEqualTo("os");
            assertThat(from.getNames()).extracting(Alias::getName).containsExactly("path", "sep");
        }

        @Test
        @DisplayName("分号分隔的简单语句")
        void testSemicolons() {
            assertThat(parse("a = 1; b = 2\n").getBody()).hasSize(2);
        }

        @Test
        @DisplayName("类定义与基类")
        void testClassDef() {
            ClassDefStmt cls = (ClassDefStmt) single("class Dog(Animal):\n    name = 'x'\n");
            assertThat(cls.getName()).isEqualTo("Dog");
            assertThat(cls.getBases()).hasSize(1);
            assertThat(cls.getBody().get(0)).isInstanceOf(AssignStmt.class);
        }
    }

    // ================================================================
    // 语法错误
    // ================================================================

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("非法参数列表")
        void testBadParameters() {
            assertThatThrownBy(() -> parse("def f(:\n    pass\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("line 1");
        }

        @Test
        @DisplayName("赋值给字面量")
        void testAssignToLiteral() {
            assertThatThrownBy(() -> parse("1 = x\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Cannot assign to expression");
        }

        @Test
        @DisplayName("词法错误在解析前抛出")
        void testLexicalError() {
            assertThatThrownBy(() -> parse("x = 'abc\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unterminated string");
        }

        @Test
        @DisplayName("意外缩进")
        void testUnexpectedIndent() {
            assertThatThrownBy(() -> parse("x = 1\n    y = 2\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unexpected indent");
        }

        @Test
        @DisplayName("try 缺少 except / finally")
        void testTryWithoutHandler() {
            assertThatThrownBy(() -> parse("try:\n    pass\nx = 1\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected 'except' or 'finally' block");
        }

        @Test
        @DisplayName("异常携带行列号")
        void testPosition() {
            ParseException e = null;
            try {
                parse("x = 1\ny = (2 +\n");
            } catch (ParseException ex) {
                e = ex;
            }
            assertThat(e).isNotNull();
            assertThat(e.getLine()).isGreaterThanOrEqualTo(2);
        }
    }
}
