package org.csu.untyped.engine;

import org.csu.untyped.compiler.parser.ast.Apply;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Identifier;
import org.csu.untyped.compiler.parser.ast.Lambda;
import org.csu.untyped.compiler.parser.ast.Parentheses;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 避免变量捕获的 beta 归约。
 *
 * 分三步完成 func(applicant):
 * <ol>
 *     <li>uniquify: 把 func 中与外层作用域或 applicant 自由变量重名的绑定变量改名为 name$N</li>
 *     <li>substitute: 在改名后的函数体中把参数替换为 applicant</li>
 *     <li>restore: 在不会造成捕获的前提下去掉 $N 后缀，恢复原始名字</li>
 * </ol>
 * 所有操作都返回新节点，不修改输入。
 */
public final class Substitution {

    /** 改名后缀的分隔符，词法器不接受该字符，所以不会与用户写的名字冲突 */
    public static final char DECORATION = '$';

    private Substitution() {
    }

    /**
     * 计算 func(applicant) 的一步 beta 归约。
     *
     * @throws IllegalArgumentException func 不是 Lambda
     */
    public static Expression apply(Expression func, Expression applicant) {
        if (!(func instanceof Lambda lambda)) {
            throw new IllegalArgumentException("Only a lambda can be applied, got: " + func);
        }
        Lambda unique = uniquify(lambda, freeVariables(applicant));
        Expression substituted = substitute(unique.body(), unique.param(), applicant);
        return restoreNames(substituted);
    }

    /**
     * 把 expr 中 old 的所有自由出现改名为 replacement。
     * 遇到重新绑定 old 的内层 Lambda 时停止下降，那里的 old 已被遮蔽。
     */
    public static Expression alphaConvert(Expression expr, Identifier old, Identifier replacement) {
        if (expr instanceof Identifier identifier) {
            return identifier.equals(old) ? identifier.rename(replacement.name()) : identifier;
        }
        if (expr instanceof Lambda lambda) {
            if (lambda.param().equals(old)) {
                return lambda;
            }
            return lambda.with(lambda.param(), alphaConvert(lambda.body(), old, replacement));
        }
        if (expr instanceof Parentheses parentheses) {
            return parentheses.with(alphaConvert(parentheses.expr(), old, replacement));
        }
        if (expr instanceof Apply apply) {
            return apply.with(alphaConvert(apply.func(), old, replacement), alphaConvert(apply.applicant(), old, replacement));
        }
        throw new IllegalStateException("Unknown expression type: " + expr.getClass().getSimpleName());
    }

    /**
     * 对整个 Lambda 做深度去重命名。
     *
     * @param lambda   要被应用的函数
     * @param reserved 不允许作为绑定变量名出现的名字 (通常是 applicant 的自由变量)
     */
    public static Lambda uniquify(Lambda lambda, Set<String> reserved) {
        Map<String, Integer> known = new HashMap<>();
        for (String name : reserved) {
            known.put(name, 0);
        }
        Set<String> taken = new HashSet<>(reserved);
        taken.addAll(allNames(lambda));
        return (Lambda) uniquify(lambda, Collections.unmodifiableMap(known), Collections.unmodifiableSet(taken));
    }

    /**
     * known 是当前作用域链上已绑定的名字到冲突计数的映射。
     * 每个分支拿到的是独立的副本，兄弟分支之间互不影响。
     */
    private static Expression uniquify(Expression expr, Map<String, Integer> known, Set<String> taken) {
        if (expr instanceof Lambda lambda) {
            Identifier param = lambda.param();
            Expression body = lambda.body();
            Map<String, Integer> inner;
            if (known.containsKey(param.name())) {
                String base = baseName(param.name());
                int count = known.getOrDefault(base, 0);
                String fresh;
                do {
                    count++;
                    fresh = base + DECORATION + count;
                } while (known.containsKey(fresh) || taken.contains(fresh));

                Identifier renamed = param.rename(fresh);
                body = alphaConvert(body, param, renamed);
                param = renamed;
                inner = with(with(known, base, count), fresh, 0);
            } else {
                inner = with(known, param.name(), 0);
            }
            return lambda.with(param, uniquify(body, inner, taken));
        }
        if (expr instanceof Parentheses parentheses) {
            return parentheses.with(uniquify(parentheses.expr(), known, taken));
        }
        if (expr instanceof Apply apply) {
            return apply.with(uniquify(apply.func(), known, taken), uniquify(apply.applicant(), known, taken));
        }
        return expr;
    }

    /**
     * 普通替换: 把 expr 中的 param 替换为 applicant。
     * 参数与 param 相同的内层 Lambda 被遮蔽，原样返回。
     */
    public static Expression substitute(Expression expr, Identifier param, Expression applicant) {
        if (expr instanceof Identifier identifier) {
            return identifier.equals(param) ? applicant : identifier;
        }
        if (expr instanceof Lambda lambda) {
            if (lambda.param().equals(param)) {
                return lambda;
            }
            return lambda.with(lambda.param(), substitute(lambda.body(), param, applicant));
        }
        if (expr instanceof Parentheses parentheses) {
            return parentheses.with(substitute(parentheses.expr(), param, applicant));
        }
        if (expr instanceof Apply apply) {
            return apply.with(substitute(apply.func(), param, applicant), substitute(apply.applicant(), param, applicant));
        }
        throw new IllegalStateException("Unknown expression type: " + expr.getClass().getSimpleName());
    }

    /**
     * 去掉绑定变量的 $N 后缀。
     * 只有当恢复原名不会捕获任何变量时才改回去，否则保留改名后的名字。
     */
    public static Expression restoreNames(Expression expr) {
        if (expr instanceof Lambda lambda) {
            Expression body = restoreNames(lambda.body());
            Identifier param = lambda.param();
            String base = baseName(param.name());
            if (!base.equals(param.name()) && canRename(body, param, base)) {
                Identifier restored = param.rename(base);
                return lambda.with(restored, alphaConvert(body, param, restored));
            }
            return lambda.with(param, body);
        }
        if (expr instanceof Parentheses parentheses) {
            return parentheses.with(restoreNames(parentheses.expr()));
        }
        if (expr instanceof Apply apply) {
            return apply.with(restoreNames(apply.func()), restoreNames(apply.applicant()));
        }
        return expr;
    }

    private static boolean canRename(Expression body, Identifier param, String base) {
        return !freeVariables(body).contains(base) && !occursFreeUnderBinder(body, param.name(), base);
    }

    /**
     * name 是否在某个绑定 binder 的内层 Lambda 中自由出现。
     */
    private static boolean occursFreeUnderBinder(Expression expr, String name, String binder) {
        if (expr instanceof Lambda lambda) {
            if (lambda.param().name().equals(name)) {
                return false;
            }
            if (lambda.param().name().equals(binder)) {
                return freeVariables(lambda.body()).contains(name);
            }
            return occursFreeUnderBinder(lambda.body(), name, binder);
        }
        if (expr instanceof Parentheses parentheses) {
            return occursFreeUnderBinder(parentheses.expr(), name, binder);
        }
        if (expr instanceof Apply apply) {
            return occursFreeUnderBinder(apply.func(), name, binder)
                    || occursFreeUnderBinder(apply.applicant(), name, binder);
        }
        return false;
    }

    public static Set<String> freeVariables(Expression expr) {
        Set<String> result = new HashSet<>();
        collectFree(expr, Collections.emptySet(), result);
        return result;
    }

    private static void collectFree(Expression expr, Set<String> bound, Set<String> result) {
        if (expr instanceof Identifier identifier) {
            if (!bound.contains(identifier.name())) {
                result.add(identifier.name());
            }
        } else if (expr instanceof Lambda lambda) {
            Set<String> inner = new HashSet<>(bound);
            inner.add(lambda.param().name());
            collectFree(lambda.body(), inner, result);
        } else if (expr instanceof Parentheses parentheses) {
            collectFree(parentheses.expr(), bound, result);
        } else if (expr instanceof Apply apply) {
            collectFree(apply.func(), bound, result);
            collectFree(apply.applicant(), bound, result);
        }
    }

    /**
     * 表达式中出现过的全部名字，包括绑定变量和自由变量。
     */
    public static Set<String> allNames(Expression expr) {
        Set<String> result = new HashSet<>();
        collectNames(expr, result);
        return result;
    }

    private static void collectNames(Expression expr, Set<String> result) {
        if (expr instanceof Identifier identifier) {
            result.add(identifier.name());
        } else if (expr instanceof Lambda lambda) {
            result.add(lambda.param().name());
            collectNames(lambda.body(), result);
        } else if (expr instanceof Parentheses parentheses) {
            collectNames(parentheses.expr(), result);
        } else if (expr instanceof Apply apply) {
            collectNames(apply.func(), result);
            collectNames(apply.applicant(), result);
        }
    }

    public static String baseName(String name) {
        int index = name.indexOf(DECORATION);
        return index < 0 ? name : name.substring(0, index);
    }

    private static Map<String, Integer> with(Map<String, Integer> known, String name, int count) {
        Map<String, Integer> copy = new HashMap<>(known);
        copy.put(name, count);
        return Collections.unmodifiableMap(copy);
    }
}
