package org.csu.qlang.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 这是 Q-Lang 线路描述语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 字面量 (Literals) ----
    GATE_NAME,  // H, X, CNOT, MOD_EXP ...
    IDENTIFIER, // 小写标识符, 经典比特名 c0, c1
    NUMBER,     // 整数常量 0, 1, 2
    PARAMETER,  // 括号包围的参数 (π/4), (7, 15)

    // ---- 分隔符和运算符 ----
    SEMICOLON,  // ;
    COMMA,      // ,
    DASH,       // -
    LPAREN,     // (
    RPAREN,     // )
    ARROW,      // ->
    EQUALS,     // ==

    // ---- 关键字 (Keywords) ----
    MEASURE,    // "measure"
    IF,         // "if"
    THEN,       // "then"
    AND,        // "and"
    OR,         // "or"
    NOT,        // "not" 保留字

    // ---- 特殊 Token ----
    COMMENT,    // # 到行尾
    NEWLINE,    // 换行符, 用于划分时间步
    EOF         // End-Of-File，表示输入流结束
}
