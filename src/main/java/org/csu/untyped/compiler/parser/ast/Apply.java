package org.csu.untyped.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 函数应用 func applicant，左结合。
 */
public record Apply(String file, int line, int column, Expression func, Expression applicant) implements Expression {

    public Apply with(Expression newFunc, Expression newApplicant) {
        return new Apply(file, line, column, newFunc, newApplicant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Apply that = (Apply) o;
        return func.equals(that.func) && applicant.equals(that.applicant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(func, applicant);
    }

    @Override
    public String toString() {
        // 区分 (x.x) y 和 x.x y
        if (func instanceof Lambda) {
            return "(" + func + ") " + applicant;
        }
        return func + " " + applicant;
    }
}
