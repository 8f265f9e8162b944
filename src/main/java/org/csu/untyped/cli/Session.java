package org.csu.untyped.cli;

import lombok.Getter;
import lombok.Setter;
import org.csu.untyped.compiler.parser.ast.Binding;
import org.csu.untyped.compiler.parser.ast.Program;
import org.csu.untyped.engine.ProgramEvaluator;
import org.csu.untyped.engine.Substitution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 代表一个交互式会话，保存已经定义的绑定和调试开关。
 */
public class Session {

    @Getter
    private final String sourceName;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    @Setter
    @Getter
    private boolean debug;

    public Session(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * 保存一个定义。表达式在定义时就闭合在它引用到的已有定义上，
     * 之后重新定义这些名字不会影响它。同名的新定义替换旧定义。
     */
    public void define(Binding binding) {
        Binding closed = close(binding);
        bindings.remove(binding.name().name());
        bindings.put(binding.name().name(), closed);
    }

    private Binding close(Binding binding) {
        Set<String> free = Substitution.freeVariables(binding.expr());
        // 已存的定义本身都是闭合的，只需要带上直接引用到的那些
        List<Binding> referenced = bindings.values().stream()
                .filter(stored -> free.contains(stored.name().name()))
                .collect(Collectors.toList());
        if (referenced.isEmpty()) {
            return binding;
        }
        Program scope = new Program(binding.file(), binding.line(), binding.column(), referenced, binding.expr());
        return new Binding(binding.file(), binding.line(), binding.column(), binding.name(), ProgramEvaluator.desugar(scope));
    }

    public List<Binding> getBindings() {
        return new ArrayList<>(bindings.values());
    }

    public void reset() {
        bindings.clear();
    }
}
