package org.csu.qlang.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 词法分析阶段的异常 (未知门名、非法字符)
 */
@Getter
public class LexicalException extends RuntimeException {

    private final int line;
    private final int column;
    private final String text;

    public LexicalException(int line, int column, String text, String reason) {
        super(String.format("Lexical Error at line %d, column %d: %s '%s'", line, column, reason, text));
        this.line = line;
        this.column = column;
        this.text = text;
    }
}
