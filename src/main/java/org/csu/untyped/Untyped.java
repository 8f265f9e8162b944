package org.csu.untyped;

import org.csu.untyped.compiler.lexer.Lexer;
import org.csu.untyped.compiler.parser.Parser;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Program;
import org.csu.untyped.engine.Normalizer;
import org.csu.untyped.engine.ProgramEvaluator;

/**
 * 库的入口: 源码进，表达式出。
 */
public final class Untyped {

    public static final String DEFAULT_FILE = "<stdin>";

    private Untyped() {
    }

    /**
     * @throws org.csu.untyped.common.exception.LexException   非法字符
     * @throws org.csu.untyped.common.exception.ParseException 语法错误或多余的输入
     */
    public static Expression parse(String source, String file) {
        return new Parser(new Lexer(file, source).tokenize(), file).parse();
    }

    public static Expression parse(String source) {
        return parse(source, DEFAULT_FILE);
    }

    public static Program parseProgram(String source, String file) {
        return new Parser(new Lexer(file, source).tokenize(), file).parseProgram();
    }

    public static Expression eval(Expression expr) {
        return Normalizer.eval(expr);
    }

    public static Expression eval(Program program) {
        return ProgramEvaluator.eval(program);
    }
}
