package org.csu.untyped.engine;

import org.csu.untyped.Untyped;
import org.csu.untyped.compiler.parser.ast.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 求值器测试。没有范式的项 (例如 (x.x x) (x.x x)) 不在这里断言结果。
 */
public class NormalizerTest {

    private static Expression eval(String source) {
        System.out.println("Eval: " + source);
        Expression result = Normalizer.eval(Untyped.parse(source, "normalizer_test.lc"));
        System.out.println("Result: " + result);
        return result;
    }

    @Test
    void testIdentity() {
        Expression result = eval("(x.x) a");
        assertInstanceOf(Identifier.class, result);
        assertEquals("a", ((Identifier) result).name());
    }

    @Test
    void testCurriedApplication() {
        assertEquals("a", eval("(x.y.x) a b").toString());
        assertEquals("b", eval("(x.y.y) a b").toString());
    }

    @Test
    void testNormalFormsAreReturnedUnchanged() {
        Expression identifier = Untyped.parse("a");
        assertSame(identifier, Normalizer.eval(identifier));

        Expression lambda = Untyped.parse("x.(y.y) x");
        assertSame(lambda, Normalizer.eval(lambda));
        assertEquals("x.(y.y) x", lambda.toString());
    }

    @Test
    void testParenthesesAreTransparent() {
        assertEquals("a", eval("((a))").toString());
        assertEquals("x.x", eval("((x.x))").toString());
    }

    @Test
    void testStuckTermIsPreserved() {
        Expression result = eval("f a");
        assertInstanceOf(Apply.class, result);
        Apply apply = (Apply) result;
        assertEquals("f", apply.func().toString());
        assertEquals("a", apply.applicant().toString());
    }

    @Test
    void testStuckTermOperandsAreEvaluated() {
        assertEquals("f a", eval("f ((x.x) a)").toString());
        assertEquals("f a b", eval("(x.x) f a b").toString());
    }

    @Test
    void testCaptureAvoidance() {
        Expression result = eval("(x.(y.x)) y");
        assertEquals("y$1.y", result.toString());

        // 再应用一次，返回的仍然是外层传入的 y
        assertEquals("y", eval("(x.(y.x)) y z").toString());
    }

    @Test
    void testShadowedParameter() {
        assertEquals("x.x", eval("(x.x.x) a").toString());
    }

    @Test
    void testChurchBooleans() {
        String and = "(p.q.p q p)";
        String tru = "(t.f.t)";
        String fls = "(t.f.f)";
        assertEquals("t.f.f", eval(and + " " + tru + " " + fls).toString());
        assertEquals("t.f.t", eval(and + " " + tru + " " + tru).toString());
    }

    @Test
    void testSelfApplicationOfIdentity() {
        assertEquals("x.x", eval("(x.x x) (x.x)").toString());
    }

    @Test
    void testEvaluationDoesNotMutateInput() {
        Expression input = Untyped.parse("(x.(y.x)) y");
        Normalizer.eval(input);
        assertEquals("(x.(y.x)) y", input.toString());
    }
}
