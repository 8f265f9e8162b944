package org.csu.untyped.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 语法错误的公共父类，携带出错位置 (file, line, column)。
 */
@Getter
public class UntypedException extends RuntimeException {

    private final String diagnostic;
    private final String file;
    private final int line;
    private final int column;

    public UntypedException(String diagnostic, String file, int line, int column) {
        super(String.format("Syntax Error at %s:%d:%d: %s", file, line, column, diagnostic));
        this.diagnostic = diagnostic;
        this.file = file;
        this.line = line;
        this.column = column;
    }
}
