package com.py2swift.compiler.codegen;

/**
 * 调用翻译结果
 *
 * <p>{@link Kind#IDIOM} 为查表得到的确定翻译；{@link Kind#PASSTHROUGH} 为原样转写，
 * 在 Swift 中不一定合法，需要人工确认。</p>
 */
public final class CallTranslation {

    public enum Kind {
        IDIOM,
        PASSTHROUGH
    }

    private final Kind kind;
    private final String code;
    private final int precedence;

    private CallTranslation(Kind kind, String code, int precedence) {
        this.kind = kind;
        this.code = code;
        this.precedence = precedence;
    }

    public static CallTranslation idiom(String code) {
        return new CallTranslation(Kind.IDIOM, code, SwiftPrecedence.POSTFIX);
    }

    public static CallTranslation idiom(String code, int precedence) {
        return new CallTranslation(Kind.IDIOM, code, precedence);
    }

    public static CallTranslation passthrough(String code) {
        return new CallTranslation(Kind.PASSTHROUGH, code, SwiftPrecedence.POSTFIX);
    }

    public Kind getKind() { return kind; }
    public String getCode() { return code; }
    public int getPrecedence() { return precedence; }
    public boolean isIdiom() { return kind == Kind.IDIOM; }

    @Override
    public String toString() {
        return kind + "(" + code + ")";
    }
}
