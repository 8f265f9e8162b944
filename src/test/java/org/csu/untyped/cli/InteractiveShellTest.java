package org.csu.untyped.cli;

import org.csu.untyped.engine.Interpreter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Scanner;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class InteractiveShellTest {

    private PrintStream out;
    private Session session;
    private InteractiveShell shell;

    @BeforeEach
    void setUp() {
        out = Mockito.mock(PrintStream.class);
        session = new Session("<stdin>");
        shell = new InteractiveShell(new Interpreter(), session, out);
    }

    @Test
    void testEvaluatesLine() {
        assertTrue(shell.handle("(x.x) a"));
        verify(out).println("a");
    }

    @Test
    void testDefinitionThenUse() {
        shell.handle("let id = x.x");
        verify(out).println("Defined: id");
        shell.handle("id b");
        verify(out).println("b");

        shell.handle(":bindings");
        verify(out).println("let id = x.x");
    }

    @Test
    void testQuit() {
        assertFalse(shell.handle(":quit"));
        assertFalse(shell.handle(":exit"));
        assertTrue(shell.handle(""));
    }

    @Test
    void testErrorKeepsShellRunning() {
        assertTrue(shell.handle("x."));
        verify(out).println(startsWith("ERROR: Syntax Error at <stdin>:1:2"));
        assertTrue(shell.handle(":nope"));
        verify(out).println("ERROR: Unknown command :nope");
    }

    @Test
    void testResetAndDebugToggle() {
        shell.handle("let id = x.x");
        shell.handle(":reset");
        verify(out).println("Bindings cleared.");
        assertTrue(session.getBindings().isEmpty());

        shell.handle(":debug");
        assertTrue(session.isDebug());
        verify(out).println("Debug on.");
        shell.handle(":debug");
        assertFalse(session.isDebug());
    }

    @Test
    void testDumpCommand() {
        shell.handle(":dump a");
        verify(out).print("Program (<stdin>:1:1)\n  Identifier a (<stdin>:1:1)\n");
    }

    @Test
    void testLoadMissingFile() {
        shell.handle(":load does/not/exist.lc");
        verify(out).println("ERROR: Could not read file: does/not/exist.lc");
    }

    @Test
    void testRunReadsContinuationLines() {
        shell.run(new Scanner("((x.x)\n a)\n:quit\n(x.x) never\n"));
        verify(out).println("a");
        verify(out, never()).println("never");
        verify(out, atLeastOnce()).print("untyped> ");
        verify(out).print("      -> ");
    }

    @Test
    void testRunScriptPrintsResult(@TempDir Path dir) throws IOException {
        Path script = dir.resolve("main.lc");
        Files.writeString(script, "k a b\nwhere\nlet k = x.y.x\n");
        PrintStream err = Mockito.mock(PrintStream.class);

        assertEquals(0, InteractiveShell.runScript(script.toString(), out, err));
        verify(out).println("a");
        verify(err, never()).println(Mockito.anyString());
    }

    @Test
    void testRunScriptReportsSyntaxError(@TempDir Path dir) throws IOException {
        Path script = dir.resolve("broken.lc");
        Files.writeString(script, "x.");
        PrintStream err = Mockito.mock(PrintStream.class);

        assertEquals(1, InteractiveShell.runScript(script.toString(), out, err));
        verify(err).println(startsWith("Syntax Error at " + script));
        verify(out, never()).println(Mockito.anyString());
    }

    @Test
    void testRunScriptMissingFile(@TempDir Path dir) {
        PrintStream err = Mockito.mock(PrintStream.class);
        String missing = dir.resolve("missing.lc").toString();

        assertEquals(1, InteractiveShell.runScript(missing, out, err));
        verify(err).println("Error reading file: " + missing);
    }
}
