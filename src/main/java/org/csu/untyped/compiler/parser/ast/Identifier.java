package org.csu.untyped.compiler.parser.ast;

/**
 * AST 节点: 表示一个变量名。
 * equals/hashCode 只看 name，同名即同一变量，与出现位置无关。
 */
public record Identifier(String file, int line, int column, String name) implements Expression {

    /**
     * 保留当前位置，替换名字。
     */
    public Identifier rename(String newName) {
        return new Identifier(file, line, column, newName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
