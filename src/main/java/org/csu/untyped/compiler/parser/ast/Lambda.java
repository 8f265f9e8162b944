package org.csu.untyped.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: param.body
 */
public record Lambda(String file, int line, int column, Identifier param, Expression body) implements Expression {

    public Lambda with(Identifier newParam, Expression newBody) {
        return new Lambda(file, line, column, newParam, newBody);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lambda that = (Lambda) o;
        return param.equals(that.param) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(param, body);
    }

    @Override
    public String toString() {
        return param + "." + body;
    }
}
