package org.csu.untyped.cli.tool;

import org.csu.untyped.compiler.parser.ast.*;

/**
 * 调试用工具类，把 AST 打印成缩进的树形结构，每层缩进两个空格。
 */
public class AstDumper {

    public static String dump(AstNode node) {
        StringBuilder sb = new StringBuilder();
        dump(node, 0, sb);
        return sb.toString();
    }

    private static void dump(AstNode node, int depth, StringBuilder sb) {
        String indent = "  ".repeat(depth);
        if (node instanceof Identifier identifier) {
            line(sb, indent, "Identifier " + identifier.name(), node);
        } else if (node instanceof Lambda lambda) {
            line(sb, indent, "Lambda", node);
            dump(lambda.param(), depth + 1, sb);
            dump(lambda.body(), depth + 1, sb);
        } else if (node instanceof Parentheses parentheses) {
            line(sb, indent, "Parentheses", node);
            dump(parentheses.expr(), depth + 1, sb);
        } else if (node instanceof Apply apply) {
            line(sb, indent, "Apply", node);
            dump(apply.func(), depth + 1, sb);
            dump(apply.applicant(), depth + 1, sb);
        } else if (node instanceof Binding binding) {
            line(sb, indent, "Binding", node);
            dump(binding.name(), depth + 1, sb);
            dump(binding.expr(), depth + 1, sb);
        } else if (node instanceof Program program) {
            line(sb, indent, "Program", node);
            for (Binding binding : program.bindings()) {
                dump(binding, depth + 1, sb);
            }
            dump(program.expr(), depth + 1, sb);
        }
    }

    private static void line(StringBuilder sb, String indent, String label, AstNode node) {
        sb.append(indent).append(label).append(" (").append(node.position()).append(")\n");
    }
}
