package org.csu.untyped.compiler.parser;

import org.csu.untyped.compiler.lexer.Token;

/**
 * 一条解析诊断信息。解析器内部以值的形式传递，只在顶层入口转换为异常。
 */
public record Diagnostic(String message, String file, int line, int column) {

    public static Diagnostic at(Token token, String message) {
        return new Diagnostic(message, token.file(), token.line(), token.column());
    }
}
