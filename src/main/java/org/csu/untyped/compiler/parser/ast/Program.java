package org.csu.untyped.compiler.parser.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AST 节点: 一个完整的源文件，若干绑定加一个主表达式。
 */
public record Program(String file, int line, int column, List<Binding> bindings, Expression expr) implements AstNode {

    public Program {
        bindings = List.copyOf(bindings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Program that = (Program) o;
        return bindings.equals(that.bindings) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, expr);
    }

    @Override
    public String toString() {
        return expr + "\nwhere\n" + bindings.stream().map(Binding::toString).collect(Collectors.joining("\n"));
    }
}
