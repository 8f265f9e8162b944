package org.csu.untyped.compiler.parser.ast;

/**
 * 所有 AST 节点的根接口。位置信息只用于诊断，不参与结构相等性比较。
 */
public sealed interface AstNode permits Expression, Binding, Program {

    String file();

    int line();

    int column();

    default String position() {
        return file() + ":" + line() + ":" + column();
    }
}
