package org.csu.untyped.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param file 所在的源文件
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, String file, int line, int column) {

    @Override
    public String toString() {
        return String.format("Token[Type=%-10s, Lexeme='%s', Position=%s:%d:%d]",
                type, lexeme, file, line, column);
    }
}
