package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.stmt.FunctionDefStmt;

import java.util.Collections;
import java.util.Map;

/**
 * 类型推断结果：函数签名表、首次赋值变量类型表、实例属性类型与表达式类型推断器
 */
public final class InferenceResult {
    private final Map<String, FunctionSignature> signatures;
    private final Map<FunctionDefStmt, FunctionSignature> signaturesByNode;
    private final Map<String, SwiftType> varTypes;
    private final Map<String, Map<String, SwiftType>> instanceAttributes;
    private final ExpressionTypeInferrer typer;

    public InferenceResult(Map<String, FunctionSignature> signatures,
                           Map<FunctionDefStmt, FunctionSignature> signaturesByNode,
                           Map<String, SwiftType> varTypes,
                           Map<String, Map<String, SwiftType>> instanceAttributes,
                           ExpressionTypeInferrer typer) {
        this.signatures = signatures;
        this.signaturesByNode = signaturesByNode;
        this.varTypes = varTypes;
        this.instanceAttributes = instanceAttributes;
        this.typer = typer;
    }

    public Map<String, FunctionSignature> getSignatures() { return Collections.unmodifiableMap(signatures); }
    public Map<String, SwiftType> getVarTypes() { return Collections.unmodifiableMap(varTypes); }
    public ExpressionTypeInferrer getTyper() { return typer; }

    /** 按函数名查找签名（同名函数以最后一次定义为准），不存在时返回 null */
    public FunctionSignature getSignature(String name) {
        return signatures.get(name);
    }

    /** 某个 def 节点自身的签名 */
    public FunctionSignature getSignature(FunctionDefStmt node) {
        FunctionSignature signature = signaturesByNode.get(node);
        return signature != null ? signature : signatures.get(node.getName());
    }

    /** 首次赋值推断出的变量类型，未记录时为 Any */
    public SwiftType getVarType(String name) {
        SwiftType type = varTypes.get(name);
        return type != null ? type : SwiftTypes.ANY;
    }

    /** __init__ 中 self.attr 赋值推断出的属性类型（按首次出现顺序） */
    public Map<String, SwiftType> getInstanceAttributes(String className) {
        Map<String, SwiftType> attributes = instanceAttributes.get(className);
        return attributes != null ? Collections.unmodifiableMap(attributes) : Collections.<String, SwiftType>emptyMap();
    }

    public SwiftType typeOf(Expression expr) {
        return typer.infer(expr);
    }

    public boolean isIntExpression(Expression expr) {
        return typer.isIntExpression(expr);
    }
}
