package org.csu.qlang.compiler.lexer;

import org.csu.qlang.common.exception.LexicalException;
import org.csu.qlang.common.model.GateCatalog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的 Q-Lang 源码分解为一系列的Token。
 * 换行符是有意义的 Token (它结束一个时间步), 空格、制表符和回车被丢弃。
 */
public class Lexer {

    private static final char DAGGER = '†';

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表, 区分大小写
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("measure", TokenType.MEASURE);
        keywords.put("if", TokenType.IF);
        keywords.put("then", TokenType.THEN);
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return 以 EOF 结尾的 Token 列表 (包含注释)
     * @throws LexicalException 遇到未知门名或非法字符时
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * 去掉注释 Token。语法分析器只接受过滤后的 Token 流。
     */
    public static List<Token> stripComments(List<Token> tokens) {
        return tokens.stream()
                .filter(t -> t.type() != TokenType.COMMENT)
                .collect(Collectors.toList());
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        if (currentChar == '\n') {
            Token token = new Token(TokenType.NEWLINE, "\n", line, column);
            position++;
            line++;
            column = 1;
            return token;
        }

        if (currentChar == '#') {
            return readComment();
        }

        // 小写开头: 关键字或经典比特名
        if (isLower(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 大写开头: 门名称, 在这里就校验白名单
        if (isUpper(currentChar)) {
            return readGateName();
        }

        if (isDigit(currentChar)) {
            return readNumber();
        }

        switch (currentChar) {
            case '(':
                Token parameter = readParameter();
                if (parameter != null) {
                    return parameter;
                }
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case '-':
                if (peekNext() == '>') {
                    Token arrow = new Token(TokenType.ARROW, "->", line, column);
                    advance();
                    advance();
                    return arrow;
                }
                return consumeAndReturn(TokenType.DASH, "-");
            case '=':
                if (peekNext() == '=') {
                    Token equals = new Token(TokenType.EQUALS, "==", line, column);
                    advance();
                    advance();
                    return equals;
                }
                throw new LexicalException(line, column, "=", "Invalid character");
            default:
                throw new LexicalException(line, column, String.valueOf(currentChar), "Invalid character");
        }
    }

    private Token readComment() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && peek() != '\n') {
            advance();
        }
        return new Token(TokenType.COMMENT, input.substring(startPos, position), line, startCol);
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && (isLower(peek()) || isDigit(peek()) || peek() == '_')) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readGateName() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isGateNamePart(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        if (!GateCatalog.isAllowed(text)) {
            throw new LexicalException(line, startCol, text, "Unknown gate");
        }
        return new Token(TokenType.GATE_NAME, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        return new Token(TokenType.NUMBER, input.substring(startPos, position), line, startCol);
    }

    /**
     * 读取一个括号平衡的参数字面量, 例如 (π/(2*2))。
     * 括号内为空、未闭合或跨行时返回 null, 由调用方按普通括号处理。
     */
    private Token readParameter() {
        int depth = 0;
        int end = position;
        while (end < input.length()) {
            char ch = input.charAt(end);
            if (ch == '\n') {
                return null;
            }
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            end++;
        }
        if (end >= input.length() || end == position + 1) {
            return null;
        }
        int startCol = column;
        String text = input.substring(position, end + 1);
        while (position <= end) {
            advance();
        }
        return new Token(TokenType.PARAMETER, text, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isGateNamePart(char c) {
        return isUpper(c) || isLower(c) || isDigit(c) || c == '_' || c == DAGGER;
    }
}
