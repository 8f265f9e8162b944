package org.csu.untyped.cli;

import org.csu.untyped.Untyped;
import org.csu.untyped.common.exception.UntypedException;
import org.csu.untyped.compiler.parser.ast.Binding;
import org.csu.untyped.engine.Interpreter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Scanner;

/**
 * 命令行入口。
 * 带一个文件参数时把文件当作程序求值并打印结果，否则启动交互式环境 (REPL)。
 */
public class InteractiveShell {

    private static final String PROMPT = "untyped> ";
    private static final String CONTINUATION_PROMPT = "      -> ";

    private final Interpreter interpreter;
    private final Session session;
    private final PrintStream out;

    public InteractiveShell(Interpreter interpreter, Session session, PrintStream out) {
        this.interpreter = interpreter;
        this.session = session;
        this.out = out;
    }

    public static void main(String[] args) {
        if (args.length > 0) {
            System.exit(runScript(args[0], System.out, System.err));
        }
        InteractiveShell shell = new InteractiveShell(new Interpreter(), new Session(Untyped.DEFAULT_FILE), System.out);
        System.out.println("Untyped lambda calculus. Type ':quit' to exit.");
        try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
            shell.run(scanner);
        }
        System.out.println("Bye!");
    }

    /**
     * 脚本模式: 把文件当作程序求值，结果写到 out，错误写到 err。
     * @return 进程退出码，成功为 0
     */
    public static int runScript(String path, PrintStream out, PrintStream err) {
        try {
            String source = Files.readString(Path.of(path));
            out.println(new Interpreter().load(source, path, new Session(path)));
            return 0;
        } catch (IOException e) {
            err.println("Error reading file: " + path);
        } catch (UntypedException e) {
            err.println(e.getMessage());
        } catch (StackOverflowError e) {
            err.println(Interpreter.NON_TERMINATION);
        }
        return 1;
    }

    public void run(Scanner scanner) {
        StringBuilder pending = new StringBuilder();
        while (true) {
            out.print(pending.length() == 0 ? PROMPT : CONTINUATION_PROMPT);
            if (!scanner.hasNextLine()) {
                return;
            }
            pending.append(scanner.nextLine());
            // 括号未闭合时继续读下一行
            if (openParentheses(pending) > 0) {
                pending.append('\n');
                continue;
            }
            String input = pending.toString();
            pending.setLength(0);
            if (!handle(input)) {
                return;
            }
        }
    }

    /**
     * 处理一行输入。
     * @return 输入为退出命令时返回 false
     */
    public boolean handle(String input) {
        String line = input.trim();
        if (line.isEmpty()) {
            return true;
        }
        if (line.equals(":quit") || line.equals(":exit")) {
            return false;
        }
        if (line.equals(":bindings")) {
            List<Binding> bindings = session.getBindings();
            if (bindings.isEmpty()) {
                out.println("No bindings.");
            }
            bindings.forEach(binding -> out.println(binding.toString()));
            return true;
        }
        if (line.equals(":reset")) {
            session.reset();
            out.println("Bindings cleared.");
            return true;
        }
        if (line.equals(":debug")) {
            session.setDebug(!session.isDebug());
            out.println("Debug " + (session.isDebug() ? "on" : "off") + ".");
            return true;
        }
        if (line.startsWith(":dump ")) {
            try {
                out.print(interpreter.dump(line.substring(":dump ".length()), session.getSourceName()));
            } catch (UntypedException e) {
                out.println("ERROR: " + e.getMessage());
            }
            return true;
        }
        if (line.startsWith(":load ")) {
            loadFile(line.substring(":load ".length()).trim());
            return true;
        }
        if (line.startsWith(":")) {
            out.println("ERROR: Unknown command " + line);
            return true;
        }
        String result = interpreter.executeAndGetResult(input, session);
        if (!result.isEmpty()) {
            out.println(result);
        }
        return true;
    }

    private void loadFile(String path) {
        try {
            String source = Files.readString(Path.of(path));
            out.println(interpreter.load(source, path, session));
        } catch (IOException e) {
            out.println("ERROR: Could not read file: " + path);
        } catch (UntypedException e) {
            out.println("ERROR: " + e.getMessage());
        } catch (StackOverflowError e) {
            out.println(Interpreter.NON_TERMINATION);
        }
    }

    private static int openParentheses(CharSequence text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
        }
        return depth;
    }
}
