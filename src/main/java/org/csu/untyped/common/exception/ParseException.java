package org.csu.untyped.common.exception;

import org.csu.untyped.compiler.parser.Diagnostic;

/**
 * @author hidyouth
 */
public class ParseException extends UntypedException {

    public ParseException(Diagnostic diagnostic) {
        super(diagnostic.message(), diagnostic.file(), diagnostic.line(), diagnostic.column());
    }
}
