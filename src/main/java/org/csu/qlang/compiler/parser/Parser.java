package org.csu.qlang.compiler.parser;

import org.csu.qlang.common.exception.ParseException;
import org.csu.qlang.common.model.GateArity;
import org.csu.qlang.common.model.GateCatalog;
import org.csu.qlang.compiler.lexer.Token;
import org.csu.qlang.compiler.lexer.TokenType;
import org.csu.qlang.compiler.parser.ast.*;
import org.csu.qlang.compiler.parser.ast.condition.AndConditionNode;
import org.csu.qlang.compiler.parser.ast.condition.BitConditionNode;
import org.csu.qlang.compiler.parser.ast.condition.ConditionNode;
import org.csu.qlang.compiler.parser.ast.condition.OrConditionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将 (已去掉注释的) Token流转换为抽象语法树(AST)。
 * 每一行是一个时间步, 行内的操作用 ';' 分隔。
 */
public class Parser {

    private static final String QUBITS_DIRECTIVE = "qubits";

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    public Program parse() {
        List<TimeStep> timeSteps = new ArrayList<>();
        Integer qubitCount = null;

        skipNewlines();
        if (isQubitsDirective()) {
            qubitCount = parseQubitsDirective();
            expectEndOfLine();
        }

        while (!isAtEnd()) {
            // 跳过空行
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            if (isQubitsDirective()) {
                throw new ParseException(peek(), "an operation ('qubits' directive is only allowed on the first line)");
            }
            timeSteps.add(parseTimeStep());
            expectEndOfLine();
        }
        return new Program(timeSteps, qubitCount);
    }

    private int parseQubitsDirective() {
        advance(); // 'qubits'
        Token countToken = consume(TokenType.NUMBER, "qubit count");
        int count = parseInteger(countToken);
        if (count <= 0) {
            throw new ParseException(countToken, "a positive qubit count");
        }
        return count;
    }

    private TimeStep parseTimeStep() {
        int line = peek().line();
        List<OperationNode> operations = new ArrayList<>();
        do {
            operations.add(parseOperation());
        } while (match(TokenType.SEMICOLON));
        return new TimeStep(operations, line);
    }

    private OperationNode parseOperation() {
        if (check(TokenType.IF)) {
            return parseConditional();
        }
        if (check(TokenType.MEASURE)) {
            return parseMeasurement();
        }
        Token gateToken = consume(TokenType.GATE_NAME, "gate name, 'measure' or 'if'");
        String gateName = gateToken.lexeme();

        GateArity arity = GateCatalog.arityOf(gateName);
        switch (arity) {
            case TWO_QUBIT:
                return parseTwoQubitGate(gateToken);
            case THREE_QUBIT:
                return parseThreeQubitGate(gateToken);
            case MODULAR:
                return parseModularGate(gateToken);
            case REGISTER:
                return new RegisterGateNode(gateName, parseQubitList(), gateToken.line(), gateToken.column());
            default:
                return parseSingleQubitGate(gateToken);
        }
    }

    private SingleQubitGateNode parseSingleQubitGate(Token gateToken) {
        String gateName = gateToken.lexeme();
        ParameterNode parameter = null;
        if (GateCatalog.isParametric(gateName)) {
            parameter = toParameter(consume(TokenType.PARAMETER, "parameter for gate '" + gateName + "'"));
        } else if (check(TokenType.PARAMETER)) {
            // 多余的参数留给语义分析器报告
            parameter = toParameter(advance());
        }
        return new SingleQubitGateNode(gateName, parseQubitList(), parameter, gateToken.line(), gateToken.column());
    }

    private TwoQubitGateNode parseTwoQubitGate(Token gateToken) {
        int control = parseQubit("control qubit");
        consume(TokenType.DASH, "'-' between control and target");
        int target = parseQubit("target qubit");
        return new TwoQubitGateNode(gateToken.lexeme(), control, target, gateToken.line(), gateToken.column());
    }

    private ThreeQubitGateNode parseThreeQubitGate(Token gateToken) {
        int control1 = parseQubit("first control qubit");
        consume(TokenType.DASH, "'-' after first control");
        int control2 = parseQubit("second control qubit");
        consume(TokenType.DASH, "'-' after second control");
        int target = parseQubit("target qubit");
        return new ThreeQubitGateNode(gateToken.lexeme(), control1, control2, target, gateToken.line(), gateToken.column());
    }

    private ModularGateNode parseModularGate(Token gateToken) {
        Token paramToken = consume(TokenType.PARAMETER, "(base, modulus) for gate '" + gateToken.lexeme() + "'");
        String[] parts = stripParentheses(paramToken).split(",", -1);
        if (parts.length != 2) {
            throw new ParseException(paramToken, "exactly two integer parameters (base, modulus)");
        }
        int base = parseIntegerParameter(paramToken, parts[0].trim());
        int modulus = parseIntegerParameter(paramToken, parts[1].trim());

        List<Integer> controls = parseQubitList();
        consume(TokenType.DASH, "'-' between control and target registers");
        List<Integer> targets = parseQubitList();
        return new ModularGateNode(gateToken.lexeme(), controls, targets, base, modulus,
                gateToken.line(), gateToken.column());
    }

    private MeasurementNode parseMeasurement() {
        Token measureToken = advance(); // 'measure'
        int qubit = parseQubit("qubit to measure");
        consume(TokenType.ARROW, "'->' after measured qubit");
        Token bitToken = consumeClassicalBit();
        return new MeasurementNode(qubit, bitToken.lexeme(), measureToken.line(), measureToken.column());
    }

    private ConditionalNode parseConditional() {
        Token ifToken = advance(); // 'if'
        ConditionNode condition = parseCondition();
        consume(TokenType.THEN, "'then' after condition");
        if (check(TokenType.IF)) {
            throw new ParseException(peek(), "an operation after 'then' (nested if-statements are not supported)");
        }
        OperationNode operation = parseOperation();
        return new ConditionalNode(condition, operation, ifToken.line(), ifToken.column());
    }

    /**
     * and/or 按出现顺序从左到右折叠: "a and b or c" 得到 ((a and b) or c)。
     */
    private ConditionNode parseCondition() {
        ConditionNode left = parsePrimaryCondition();
        while (true) {
            if (match(TokenType.AND)) {
                Token operator = previous();
                ConditionNode right = parsePrimaryCondition();
                left = new AndConditionNode(left, right, operator.line(), operator.column());
            } else if (match(TokenType.OR)) {
                Token operator = previous();
                ConditionNode right = parsePrimaryCondition();
                left = new OrConditionNode(left, right, operator.line(), operator.column());
            } else {
                return left;
            }
        }
    }

    private BitConditionNode parsePrimaryCondition() {
        Token bitToken = consumeClassicalBit();
        Integer expected = null;
        if (match(TokenType.EQUALS)) {
            Token valueToken = consume(TokenType.NUMBER, "bit value after '=='");
            int value = parseInteger(valueToken);
            if (value != 0 && value != 1) {
                throw new ParseException(valueToken, "classical bit value 0 or 1");
            }
            expected = value;
        }
        return new BitConditionNode(bitToken.lexeme(), expected, bitToken.line(), bitToken.column());
    }

    private List<Integer> parseQubitList() {
        List<Integer> qubits = new ArrayList<>();
        do {
            qubits.add(parseQubit("qubit index"));
        } while (match(TokenType.COMMA));
        return qubits;
    }

    private int parseQubit(String what) {
        return parseInteger(consume(TokenType.NUMBER, what));
    }

    // 经典比特名一般是小写标识符, 也接受恰好是门名的大写名字
    private Token consumeClassicalBit() {
        if (check(TokenType.IDENTIFIER) || check(TokenType.GATE_NAME)) {
            return advance();
        }
        throw new ParseException(peek(), "IDENTIFIER (classical bit name)");
    }

    private ParameterNode toParameter(Token paramToken) {
        return new ParameterNode(stripParentheses(paramToken).trim(), paramToken.line(), paramToken.column());
    }

    private String stripParentheses(Token paramToken) {
        String text = paramToken.lexeme();
        return text.substring(1, text.length() - 1);
    }

    private int parseInteger(Token token) {
        try {
            return Integer.parseInt(token.lexeme());
        } catch (NumberFormatException e) {
            throw new ParseException(token, "an integer within range");
        }
    }

    private int parseIntegerParameter(Token paramToken, String text) {
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            throw new ParseException(paramToken, "integer parameters (base, modulus), got '" + text + "'");
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ParseException(paramToken, "integer parameters within range");
        }
    }

    private boolean isQubitsDirective() {
        return check(TokenType.IDENTIFIER)
                && QUBITS_DIRECTIVE.equals(peek().lexeme())
                && peekNext().type() == TokenType.NUMBER;
    }

    private void expectEndOfLine() {
        if (!isAtEnd()) {
            consume(TokenType.NEWLINE, "end of line or ';'");
        }
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // 跳过开头的空行
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), type + " (" + message + ")");
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekNext() {
        if (position + 1 >= tokens.size()) return tokens.get(tokens.size() - 1);
        return tokens.get(position + 1);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
