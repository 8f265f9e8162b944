package org.csu.untyped.common.exception;

/**
 * @author hidyouth
 * @description: 词法分析阶段遇到非法字符时抛出，立即终止整个解析过程。
 */
public class LexException extends UntypedException {

    public LexException(char unexpected, String file, int line, int column) {
        super("Unexpected character '" + unexpected + "'", file, line, column);
    }
}
