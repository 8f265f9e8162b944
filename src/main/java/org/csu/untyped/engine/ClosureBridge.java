package org.csu.untyped.engine;

import org.csu.untyped.compiler.parser.ast.Apply;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Identifier;
import org.csu.untyped.compiler.parser.ast.Lambda;
import org.csu.untyped.compiler.parser.ast.Parentheses;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 把表达式翻译成 Java 闭包 (嵌套的 {@link Function})，直接在 JVM 上执行，
 * 不经过 {@link Normalizer}。按值调用。
 */
public final class ClosureBridge {

    private ClosureBridge() {
    }

    public static Object toClosure(Expression expr) {
        return toClosure(expr, Collections.emptyMap());
    }

    /**
     * @param environment 自由变量的取值，例如 Church 数的后继函数
     * @throws IllegalArgumentException 存在未提供取值的自由变量
     */
    public static Object toClosure(Expression expr, Map<String, Object> environment) {
        if (expr instanceof Identifier identifier) {
            if (!environment.containsKey(identifier.name())) {
                throw new IllegalArgumentException("Unbound identifier '" + identifier.name() + "' at " + identifier.position());
            }
            return environment.get(identifier.name());
        }
        if (expr instanceof Lambda lambda) {
            Function<Object, Object> closure = argument ->
                    toClosure(lambda.body(), with(environment, lambda.param().name(), argument));
            return closure;
        }
        if (expr instanceof Parentheses parentheses) {
            return toClosure(parentheses.expr(), environment);
        }
        if (expr instanceof Apply apply) {
            Object func = toClosure(apply.func(), environment);
            Object applicant = toClosure(apply.applicant(), environment);
            return call(func, applicant);
        }
        throw new IllegalStateException("Unknown expression type: " + expr.getClass().getSimpleName());
    }

    /**
     * Church 数转为 int: n (x -> x + 1) 0
     */
    public static int toInt(Object churchNumeral) {
        Function<Object, Object> increment = x -> (Integer) x + 1;
        return (Integer) call(call(churchNumeral, increment), 0);
    }

    /**
     * Church 布尔值转为 boolean: b true false
     */
    public static boolean toBoolean(Object churchBoolean) {
        return (Boolean) call(call(churchBoolean, Boolean.TRUE), Boolean.FALSE);
    }

    @SuppressWarnings("unchecked")
    private static Object call(Object func, Object argument) {
        if (!(func instanceof Function)) {
            throw new IllegalStateException("Cannot apply a non-function value: " + func);
        }
        return ((Function<Object, Object>) func).apply(argument);
    }

    private static Map<String, Object> with(Map<String, Object> environment, String name, Object value) {
        Map<String, Object> copy = new HashMap<>(environment);
        copy.put(name, value);
        return copy;
    }
}
