package org.csu.untyped.engine;

import org.csu.untyped.compiler.parser.ast.Apply;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Identifier;
import org.csu.untyped.compiler.parser.ast.Lambda;
import org.csu.untyped.compiler.parser.ast.Parentheses;

/**
 * 表达式求值器。
 * 按应用序 (applicative order) 反复做 beta 归约，直到得到范式或卡住的中性项。
 *
 * 不保证终止: 没有范式的项会一直递归直到栈溢出。
 */
public final class Normalizer {

    private Normalizer() {
    }

    public static Expression eval(Expression expr) {
        if (expr instanceof Identifier || expr instanceof Lambda) {
            return expr;
        }
        if (expr instanceof Parentheses parentheses) {
            return eval(parentheses.expr());
        }
        if (expr instanceof Apply apply) {
            // 两边先各自求值，再尝试归约
            Expression func = eval(apply.func());
            Expression applicant = eval(apply.applicant());
            if (func instanceof Lambda) {
                return eval(Substitution.apply(func, applicant));
            }
            // 头部不是 Lambda (例如自由变量)，保留为中性项
            return apply.with(func, applicant);
        }
        throw new IllegalStateException("Unknown expression type: " + expr.getClass().getSimpleName());
    }
}
