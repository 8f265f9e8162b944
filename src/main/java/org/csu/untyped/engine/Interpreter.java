package org.csu.untyped.engine;

import org.csu.untyped.cli.Session;
import org.csu.untyped.cli.tool.AstDumper;
import org.csu.untyped.common.exception.UntypedException;
import org.csu.untyped.compiler.lexer.Lexer;
import org.csu.untyped.compiler.lexer.Token;
import org.csu.untyped.compiler.lexer.TokenType;
import org.csu.untyped.compiler.parser.Parser;
import org.csu.untyped.compiler.parser.ast.Binding;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Program;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 解释器门面: 把一段源码交给词法、语法分析和求值器，返回可以直接打印的结果。
 */
public class Interpreter {

    public static final String NON_TERMINATION = "ERROR: evaluation did not terminate (stack exhausted)";

    public String executeAndGetResult(String source, Session session) {
        try {
            return execute(source, session.getSourceName(), session);
        } catch (UntypedException e) {
            return "ERROR: " + e.getMessage();
        } catch (StackOverflowError e) {
            return NON_TERMINATION;
        }
    }

    /**
     * 执行一段源码。只有定义的输入会存进会话，其余输入作为程序求值，
     * 会话中已有的定义排在程序自身的绑定之前。
     *
     * @throws UntypedException 词法或语法错误
     */
    public String execute(String source, String file, Session session) {
        List<Token> tokens = new Lexer(file, source).tokenize();
        if (session.isDebug()) {
            System.out.println("[DEBUG] Tokens: " + tokens);
        }
        if (tokens.isEmpty()) {
            return "";
        }

        Parser parser = new Parser(tokens, file);
        if (tokens.get(0).type() == TokenType.LET) {
            List<Binding> definitions = parser.parseDefinitions();
            definitions.forEach(session::define);
            return "Defined: " + definitions.stream()
                    .map(binding -> binding.name().name())
                    .collect(Collectors.joining(", "));
        }

        Program program = parser.parseProgram();
        if (session.isDebug()) {
            System.out.println("[DEBUG] AST:\n" + AstDumper.dump(program));
        }
        Program scoped = new Program(program.file(), program.line(), program.column(),
                withSession(session, program.bindings()), program.expr());
        return ProgramEvaluator.eval(scoped).toString();
    }

    /**
     * 加载源文件: 文件中的绑定全部存进会话，若有主表达式则求值。
     */
    public String load(String source, String file, Session session) {
        List<Token> tokens = new Lexer(file, source).tokenize();
        if (tokens.isEmpty()) {
            return "Loaded " + file;
        }
        Parser parser = new Parser(tokens, file);
        if (tokens.get(0).type() == TokenType.LET) {
            parser.parseDefinitions().forEach(session::define);
            return "Loaded " + file;
        }
        Program program = parser.parseProgram();
        Expression result = ProgramEvaluator.eval(new Program(program.file(), program.line(), program.column(),
                withSession(session, program.bindings()), program.expr()));
        program.bindings().forEach(session::define);
        return result.toString();
    }

    public String dump(String source, String file) {
        List<Token> tokens = new Lexer(file, source).tokenize();
        return AstDumper.dump(new Parser(tokens, file).parseProgram());
    }

    private static List<Binding> withSession(Session session, List<Binding> own) {
        List<Binding> bindings = new ArrayList<>(session.getBindings());
        bindings.addAll(own);
        return bindings;
    }
}
