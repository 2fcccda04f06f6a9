package io.logscope.engine.query.parser;

enum TokenType {
    IDENTIFIER,
    STRING,
    INTEGER,
    FLOAT,
    OPERATOR,
    KEYWORD,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    DOT,
    EOF
}
