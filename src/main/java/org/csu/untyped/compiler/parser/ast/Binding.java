package org.csu.untyped.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 顶层命名定义 let name = expr
 */
public record Binding(String file, int line, int column, Identifier name, Expression expr) implements AstNode {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding that = (Binding) o;
        return name.equals(that.name) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expr);
    }

    @Override
    public String toString() {
        return "let " + name + " = " + expr;
    }
}
