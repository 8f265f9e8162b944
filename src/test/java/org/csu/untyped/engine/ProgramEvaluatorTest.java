package org.csu.untyped.engine;

import org.csu.untyped.Untyped;
import org.csu.untyped.compiler.parser.ast.Apply;
import org.csu.untyped.compiler.parser.ast.Expression;
import org.csu.untyped.compiler.parser.ast.Program;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramEvaluatorTest {

    private static final String CHURCH = "\nwhere\n"
            + "let true = t.f.t\n"
            + "let false = t.f.f\n"
            + "let not = b.b false true\n"
            + "let two = f.x.f (f x)\n"
            + "let three = f.x.f (f (f x))\n"
            + "let plus = m.n.f.x.m f (n f x)\n"
            + "let mult = m.n.f.m (n f)\n";

    private static Expression run(String source) {
        Program program = Untyped.parseProgram(source, "program_test.lc");
        return ProgramEvaluator.eval(program);
    }

    @Test
    void testBindingIsSubstitutedIntoBody() {
        assertEquals("a", run("id a where let id = x.x").toString());
    }

    @Test
    void testLaterBindingsSeeEarlierOnes() {
        assertEquals("c", run("b where let a = x.x let b = a c").toString());
    }

    @Test
    void testProgramWithoutBindings() {
        assertEquals("a", run("(x.x) a").toString());
    }

    @Test
    void testDesugarShape() {
        Program program = Untyped.parseProgram("f where let f = x.x", "program_test.lc");
        assertEquals("(f.f) x.x", ProgramEvaluator.desugar(program).toString());
    }

    @Test
    void testChurchBooleans() {
        assertFalse(ClosureBridge.toBoolean(ClosureBridge.toClosure(run("not true" + CHURCH))));
        assertTrue(ClosureBridge.toBoolean(ClosureBridge.toClosure(run("not false" + CHURCH))));
    }

    @Test
    void testChurchArithmetic() {
        assertEquals(5, ClosureBridge.toInt(ClosureBridge.toClosure(run("plus two three" + CHURCH))));
        assertEquals(6, ClosureBridge.toInt(ClosureBridge.toClosure(run("mult two three" + CHURCH))));
    }

    @Test
    void testFreeVariablesStayNeutral() {
        Expression result = run("two s z" + CHURCH);
        // 求值时括号被去掉，只保留结构
        assertEquals("s s z", result.toString());
        Apply outer = (Apply) result;
        assertEquals("s", outer.func().toString());
        assertInstanceOf(Apply.class, outer.applicant());
    }

    @Test
    void testUntypedFacadeEvaluatesProgram() {
        Program program = Untyped.parseProgram("k a b where let k = x.y.x", "program_test.lc");
        assertEquals("a", Untyped.eval(program).toString());
    }
}
