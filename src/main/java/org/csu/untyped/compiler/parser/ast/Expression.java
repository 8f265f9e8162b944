package org.csu.untyped.compiler.parser.ast;

/**
 * 可归约的表达式: Identifier | Lambda | Parentheses | Apply
 */
public sealed interface Expression extends AstNode permits Identifier, Lambda, Parentheses, Apply {
}
