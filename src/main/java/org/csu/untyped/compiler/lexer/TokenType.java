package org.csu.untyped.compiler.lexer;

import org.csu.untyped.compiler.parser.Diagnostic;
import org.csu.untyped.compiler.parser.ParseResult;

import java.util.List;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 */
public enum TokenType {
    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 变量名、参数名、绑定名

    // ---- 分隔符 (Delimiters) ----
    DOT,        // .
    EQUAL,      // =
    L_PAREN,    // (
    R_PAREN,    // )

    // ---- 关键字 (Keywords) ----
    LET,        // "let"
    WHERE;      // "where"

    /**
     * 检查 position 处的 Token 是否为当前类型。
     * 不消耗任何输入，失败时返回诊断信息而不是抛异常。
     *
     * @param tokens   完整的 Token 序列
     * @param position 待检查的位置
     * @param file     源文件名，用于空输入时的诊断
     */
    public ParseResult<Token> expect(List<Token> tokens, int position, String file) {
        if (position >= tokens.size()) {
            if (tokens.isEmpty()) {
                return ParseResult.failure(new Diagnostic("Expected " + name() + " but found EOF", file, 1, 1));
            }
            Token last = tokens.get(tokens.size() - 1);
            return ParseResult.failure(Diagnostic.at(last, "Expected " + name() + " but found EOF"));
        }
        Token token = tokens.get(position);
        if (token.type() != this) {
            return ParseResult.failure(Diagnostic.at(token, "Expected " + name() + " but found " + token.type().name()));
        }
        return ParseResult.success(token, position + 1);
    }
}
