package org.csu.untyped.compiler.lexer;

import org.csu.untyped.common.exception.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的 lambda 表达式源码分解为一系列的Token。
 * 不产生 EOF Token，序列结束即输入结束。
 */
public class Lexer {

    private final String file;
    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    public Lexer(String file, String input) {
        this.file = file;
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return 不可修改的Token列表
     * @throws LexException 遇到无法识别的字符
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        skipWhitespace();
        while (position < input.length()) {
            tokens.add(nextToken());
            skipWhitespace();
        }
        return Collections.unmodifiableList(tokens);
    }

    private Token nextToken() {
        char currentChar = peek();

        switch (currentChar) {
            case '.':
                return consumeAndReturn(TokenType.DOT, ".");
            case '=':
                return consumeAndReturn(TokenType.EQUAL, "=");
            case '(':
                return consumeAndReturn(TokenType.L_PAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.R_PAREN, ")");
            default:
                break;
        }

        // 关键字按固定长度向前看识别，不经过标识符再分类
        if (lookingAt("let")) {
            return consumeKeyword(TokenType.LET, "let");
        }
        if (lookingAt("where")) {
            return consumeKeyword(TokenType.WHERE, "where");
        }

        if (isLetter(currentChar)) {
            return readIdentifier();
        }

        throw new LexException(currentChar, file, line, column);
    }

    private Token readIdentifier() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        return new Token(TokenType.IDENTIFIER, input.substring(startPos, position), file, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else {
                break;
            }
        }
    }

    private boolean lookingAt(String keyword) {
        return input.startsWith(keyword, position);
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, file, line, column);
        advance();
        return token;
    }

    private Token consumeKeyword(TokenType type, String keyword) {
        Token token = new Token(type, keyword, file, line, column);
        for (int i = 0; i < keyword.length(); i++) {
            advance();
        }
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
