package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("作用域栈")
class ScopeManagerTest {

    @Test
    @DisplayName("初始只有 global 帧")
    void testInitialState() {
        ScopeManager scopes = new ScopeManager();
        assertThat(scopes.depth()).isEqualTo(1);
        assertThat(scopes.currentScope().getType()).isEqualTo(Scope.ScopeType.GLOBAL);
        assertThat(scopes.currentScope().getTag()).isEqualTo("global");
    }

    @Test
    @DisplayName("由内向外查找")
    void testLookupWalksOutward() {
        ScopeManager scopes = new ScopeManager();
        scopes.declare("count", SwiftTypes.INT, true);
        scopes.pushScope(Scope.ScopeType.FUNCTION, "f");
        scopes.declare("local", SwiftTypes.STRING, false);

        assertThat(scopes.lookup("count").getInferredType()).isEqualTo(SwiftTypes.INT);
        assertThat(scopes.lookup("local").getScopeKind()).isEqualTo("func:f");
        assertThat(scopes.isDeclaredInCurrentScope("count")).isFalse();
        assertThat(scopes.isDeclaredInCurrentScope("local")).isTrue();
    }

    @Test
    @DisplayName("内层同名符号遮蔽外层")
    void testShadowing() {
        ScopeManager scopes = new ScopeManager();
        scopes.declare("x", SwiftTypes.INT, false);
        scopes.pushScope(Scope.ScopeType.FUNCTION, "f");
        scopes.declare("x", SwiftTypes.STRING, true);

        assertThat(scopes.lookup("x").getInferredType()).isEqualTo(SwiftTypes.STRING);
        scopes.popScope();
        assertThat(scopes.lookup("x").getInferredType()).isEqualTo(SwiftTypes.INT);
    }

    @Test
    @DisplayName("弹出后局部符号不可见")
    void testPopDiscardsLocals() {
        ScopeManager scopes = new ScopeManager();
        scopes.pushScope(Scope.ScopeType.CLASS, "Point");
        assertThat(scopes.inClassBody()).isTrue();
        scopes.declare("origin", SwiftTypes.ANY, true);
        scopes.popScope();

        assertThat(scopes.lookup("origin")).isNull();
        assertThat(scopes.inClassBody()).isFalse();
    }

    @Test
    @DisplayName("global 帧不会被弹出")
    void testGlobalNeverPopped() {
        ScopeManager scopes = new ScopeManager();
        scopes.declare("g", SwiftTypes.BOOL, true);
        scopes.popScope();
        scopes.popScope();

        assertThat(scopes.depth()).isEqualTo(1);
        assertThat(scopes.lookup("g")).isNotNull();
    }

    @Test
    @DisplayName("以符号对象声明时按名称重建")
    void testDeclareSymbolUnderAlias() {
        ScopeManager scopes = new ScopeManager();
        scopes.declare("alias", new Symbol("original", SwiftTypes.DOUBLE, false, "global"));

        Symbol symbol = scopes.lookup("alias");
        assertThat(symbol.getName()).isEqualTo("alias");
        assertThat(symbol.getInferredType()).isEqualTo(SwiftTypes.DOUBLE);
        assertThat(symbol.isMutable()).isFalse();
    }

    @Test
    @DisplayName("作用域标签")
    void testTags() {
        assertThat(new Scope(Scope.ScopeType.FUNCTION, "main").getTag()).isEqualTo("func:main");
        assertThat(new Scope(Scope.ScopeType.CLASS, "Dog").getTag()).isEqualTo("class:Dog");
        assertThat(new Scope(Scope.ScopeType.BLOCK, null).getTag()).isEqualTo("block");
    }
}
