package com.ldgv.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    LESS, GREATER, COMMA, COLON, DOT, EQUAL,
    PLUS, MINUS, STAR, SLASH, BANG, QUESTION, TILDE,

    // Two-character tokens
    ARROW, FAT_ARROW,

    // Literals
    IDENTIFIER, LABEL, NUMBER,

    // Keywords
    LET, IN, FN, LIN, FST, SND, SUCC, FORK, NEW, SEND, RECV,
    CASE, OF, NATREC, ZERO, VAL, TYPE,

    EOF
}
