package org.csu.untyped.compiler.parser;

import org.csu.untyped.common.exception.ParseException;
import org.csu.untyped.compiler.lexer.Token;
import org.csu.untyped.compiler.lexer.TokenType;
import org.csu.untyped.compiler.parser.ParseResult.Failure;
import org.csu.untyped.compiler.parser.ParseResult.Success;
import org.csu.untyped.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用带回溯的递归下降法，将Token流转换为抽象语法树(AST)。
 *
 * 每个规则都是 (position) -> ParseResult 的纯函数，不修改任何状态；
 * 候选规则失败时不消耗输入，由调用方从同一位置尝试下一个候选。
 *
 * <pre>
 * Program     := Binding* Expr (WHERE Binding*)?
 * Binding     := LET IDENTIFIER EQUAL Expr
 * Expr        := Apply | PrimalExpr
 * Apply       := PrimalExpr PrimalExpr+
 * PrimalExpr  := Lambda | Parentheses | IDENTIFIER
 * Lambda      := IDENTIFIER DOT Expr
 * Parentheses := L_PAREN Expr R_PAREN
 * </pre>
 */
public class Parser {

    private final List<Token> tokens;
    private final String file;

    public Parser(List<Token> tokens, String file) {
        this.tokens = List.copyOf(tokens);
        this.file = file;
    }

    /**
     * 顶层入口: 从位置 0 解析一个表达式，并要求消耗全部 Token。
     * @throws ParseException 解析失败或存在多余的 Token
     */
    public Expression parse() {
        return complete(parseExpression(0));
    }

    /**
     * 顶层入口: 解析一个完整的程序 (绑定 + 主表达式)。
     */
    public Program parseProgram() {
        List<Binding> bindings = new ArrayList<>();
        int position = parseBindings(0, bindings);

        ParseResult<Expression> body = parseExpression(position);
        if (body instanceof Failure<Expression> failure) {
            throw new ParseException(failure.diagnostic());
        }
        Success<Expression> success = (Success<Expression>) body;
        position = success.next();

        ParseResult<Token> where = TokenType.WHERE.expect(tokens, position, file);
        if (where instanceof Success<Token> keyword) {
            position = parseBindings(keyword.next(), bindings);
        }

        Program program = tokens.isEmpty()
                ? new Program(file, 1, 1, bindings, success.node())
                : new Program(file, tokens.get(0).line(), tokens.get(0).column(), bindings, success.node());
        return complete(ParseResult.success(program, position));
    }

    /**
     * 顶层入口: 只包含绑定的输入，例如交互式环境中的一行定义。
     */
    public List<Binding> parseDefinitions() {
        List<Binding> bindings = new ArrayList<>();
        int position = parseBindings(0, bindings);
        if (bindings.isEmpty()) {
            ParseResult<Token> let = TokenType.LET.expect(tokens, 0, file);
            return complete(let.<List<Binding>>asFailure());
        }
        return complete(ParseResult.success(bindings, position));
    }

    public ParseResult<Expression> parseExpression(int position) {
        ParseResult<Expression> apply = parseApply(position);
        if (apply.isSuccess()) {
            return apply;
        }
        return parsePrimalExpression(position);
    }

    public ParseResult<Expression> parsePrimalExpression(int position) {
        ParseResult<Expression> lambda = parseLambda(position);
        if (lambda.isSuccess()) {
            return lambda;
        }
        ParseResult<Expression> parentheses = parseParentheses(position);
        if (parentheses.isSuccess()) {
            return parentheses;
        }
        return parseIdentifier(position).map(identifier -> identifier);
    }

    public ParseResult<Expression> parseApply(int position) {
        ParseResult<Expression> first = parsePrimalExpression(position);
        if (!(first instanceof Success<Expression> head)) {
            return first;
        }
        Expression func = head.node();
        int next = head.next();

        // 贪心地继续解析 PrimalExpr 并左折叠成嵌套的 Apply
        Token start = tokens.get(position);
        while (parsePrimalExpression(next) instanceof Success<Expression> applicant) {
            func = new Apply(start.file(), start.line(), start.column(), func, applicant.node());
            next = applicant.next();
        }
        return ParseResult.success(func, next);
    }

    public ParseResult<Expression> parseLambda(int position) {
        ParseResult<Identifier> param = parseIdentifier(position);
        if (!(param instanceof Success<Identifier> paramResult)) {
            return param.asFailure();
        }
        ParseResult<Token> dot = TokenType.DOT.expect(tokens, paramResult.next(), file);
        if (!(dot instanceof Success<Token> dotResult)) {
            return dot.asFailure();
        }
        Token start = tokens.get(position);
        return parseExpression(dotResult.next()).map(body ->
                new Lambda(start.file(), start.line(), start.column(), paramResult.node(), body));
    }

    public ParseResult<Expression> parseParentheses(int position) {
        ParseResult<Token> open = TokenType.L_PAREN.expect(tokens, position, file);
        if (!(open instanceof Success<Token> openResult)) {
            return open.asFailure();
        }
        ParseResult<Expression> inner = parseExpression(openResult.next());
        if (!(inner instanceof Success<Expression> innerResult)) {
            return inner;
        }
        ParseResult<Token> close = TokenType.R_PAREN.expect(tokens, innerResult.next(), file);
        if (!(close instanceof Success<Token> closeResult)) {
            return close.asFailure();
        }
        Token start = openResult.node();
        return ParseResult.success(
                new Parentheses(start.file(), start.line(), start.column(), innerResult.node()),
                closeResult.next());
    }

    public ParseResult<Binding> parseBinding(int position) {
        ParseResult<Token> let = TokenType.LET.expect(tokens, position, file);
        if (!(let instanceof Success<Token> letResult)) {
            return let.asFailure();
        }
        ParseResult<Identifier> name = parseIdentifier(letResult.next());
        if (!(name instanceof Success<Identifier> nameResult)) {
            return name.asFailure();
        }
        ParseResult<Token> equal = TokenType.EQUAL.expect(tokens, nameResult.next(), file);
        if (!(equal instanceof Success<Token> equalResult)) {
            return equal.asFailure();
        }
        Token start = letResult.node();
        return parseExpression(equalResult.next()).map(expr ->
                new Binding(start.file(), start.line(), start.column(), nameResult.node(), expr));
    }

    private ParseResult<Identifier> parseIdentifier(int position) {
        return TokenType.IDENTIFIER.expect(tokens, position, file)
                .map(token -> new Identifier(token.file(), token.line(), token.column(), token.lexeme()));
    }

    /**
     * 连续解析绑定，直到下一个 Token 不是 LET。
     * 已经以 LET 开头却解析失败的绑定是硬错误，直接抛出。
     */
    private int parseBindings(int position, List<Binding> bindings) {
        while (TokenType.LET.expect(tokens, position, file).isSuccess()) {
            ParseResult<Binding> binding = parseBinding(position);
            if (binding instanceof Failure<Binding> failure) {
                throw new ParseException(failure.diagnostic());
            }
            Success<Binding> success = (Success<Binding>) binding;
            bindings.add(success.node());
            position = success.next();
        }
        return position;
    }

    private <T> T complete(ParseResult<T> result) {
        if (result instanceof Failure<T> failure) {
            throw new ParseException(failure.diagnostic());
        }
        Success<T> success = (Success<T>) result;
        if (success.next() != tokens.size()) {
            Token trailing = tokens.get(success.next());
            throw new ParseException(Diagnostic.at(trailing, "Expected EOF but found " + trailing.type().name()));
        }
        return success.node();
    }
}
