package org.csu.untyped.compiler.parser;

import java.util.function.Function;

/**
 * 解析函数的返回值：要么成功 (结果 + 下一个位置)，要么失败 (诊断信息)。
 * 失败不消耗任何 Token，调用方可以从同一位置尝试下一个候选规则。
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    record Success<T>(T node, int next) implements ParseResult<T> {
    }

    record Failure<T>(Diagnostic diagnostic) implements ParseResult<T> {
    }

    static <T> ParseResult<T> success(T node, int next) {
        return new Success<>(node, next);
    }

    static <T> ParseResult<T> failure(Diagnostic diagnostic) {
        return new Failure<>(diagnostic);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 把失败结果转换为另一种结果类型，诊断信息原样保留。
     */
    default <R> ParseResult<R> asFailure() {
        if (this instanceof Failure<T> failure) {
            return new Failure<>(failure.diagnostic());
        }
        throw new IllegalStateException("Not a failure: " + this);
    }

    default <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.node()), success.next());
        }
        return asFailure();
    }
}
