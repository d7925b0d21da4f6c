package org.csu.qlang.common.exception;

import lombok.Getter;
import org.csu.qlang.compiler.lexer.Token;
import org.csu.qlang.compiler.lexer.TokenType;

/**
 * @author hidyouth
 */
@Getter
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final String expected;
    private final TokenType actualType;
    private final String actualText;

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                token.line(),
                token.column(),
                expected,
                token.lexeme().equals("\n") ? "\\n" : token.lexeme(),
                token.type()));
        this.line = token.line();
        this.column = token.column();
        this.expected = expected;
        this.actualType = token.type();
        this.actualText = token.lexeme();
    }
}
