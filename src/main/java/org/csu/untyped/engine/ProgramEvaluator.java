package org.csu.untyped.engine;

import org.csu.untyped.compiler.parser.ast.Apply;
import org.csu.untyped.compiler.parser.ast.Binding;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Lambda;
import org.csu.untyped.compiler.parser.ast.Parentheses;
import org.csu.untyped.compiler.parser.ast.Program;

import java.util.List;

/**
 * 对整个 Program 求值。
 * 绑定按顺序生效: 第 i 个绑定可以引用前面的绑定，主表达式可以引用全部绑定。
 */
public final class ProgramEvaluator {

    private ProgramEvaluator() {
    }

    public static Expression eval(Program program) {
        return Normalizer.eval(desugar(program));
    }

    /**
     * let a = e1 let b = e2 body  ==>  (a.((b.body) e2)) e1
     */
    public static Expression desugar(Program program) {
        List<Binding> bindings = program.bindings();
        Expression result = program.expr();
        for (int i = bindings.size() - 1; i >= 0; i--) {
            Binding binding = bindings.get(i);
            Lambda scope = new Lambda(binding.file(), binding.line(), binding.column(), binding.name(), result);
            Parentheses func = new Parentheses(binding.file(), binding.line(), binding.column(), scope);
            result = new Apply(binding.file(), binding.line(), binding.column(), func, binding.expr());
        }
        return result;
    }
}
