package org.csu.untyped.compiler.parser.ast;

/**
 * AST 节点: (expr)，纯语法分组，求值和替换时透明，打印时保留。
 */
public record Parentheses(String file, int line, int column, Expression expr) implements Expression {

    public Parentheses with(Expression newExpr) {
        return new Parentheses(file, line, column, newExpr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return expr.equals(((Parentheses) o).expr);
    }

    @Override
    public int hashCode() {
        return 31 + expr.hashCode();
    }

    @Override
    public String toString() {
        return "(" + expr + ")";
    }
}
