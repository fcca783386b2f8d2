package com.logicsynth.grammar;

public enum TokenType {
    IDENT,
    VARIABLE,
    NAME,
    STRING,
    BYTES,
    NUMBER,
    FLOAT,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    DOT,
    COLON,
    BANG,
    NOT_EQUAL,
    EQUAL,
    IMPLIES,
    PIPE,
    QUESTION,
    EOF
}
