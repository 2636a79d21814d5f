package com.ldgv.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("let", TokenType.LET);
        map.put("in", TokenType.IN);
        map.put("fn", TokenType.FN);
        map.put("lin", TokenType.LIN);
        map.put("fst", TokenType.FST);
        map.put("snd", TokenType.SND);
        map.put("succ", TokenType.SUCC);
        map.put("fork", TokenType.FORK);
        map.put("new", TokenType.NEW);
        map.put("send", TokenType.SEND);
        map.put("recv", TokenType.RECV);
        map.put("case", TokenType.CASE);
        map.put("of", TokenType.OF);
        map.put("natrec", TokenType.NATREC);
        map.put("zero", TokenType.ZERO);
        map.put("val", TokenType.VAL);
        map.put("type", TokenType.TYPE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '!': addToken(TokenType.BANG); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '~': addToken(TokenType.TILDE); break;
            case '=': addToken(match('>') ? TokenType.FAT_ARROW : TokenType.EQUAL); break;
            case '-':
                if (match('-')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('>')) {
                    addToken(TokenType.ARROW);
                } else {
                    addToken(TokenType.MINUS);
                }
                break;
            case '\'':
                label();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void label() {
        if (!isAlpha(peek())) throw error("Expect label name after '''");
        while (isAlphaNumeric(peek())) advance();
        // lexeme keeps the quote, literal is the bare name
        addToken(TokenType.LABEL, source.substring(start + 1, current));
    }

    private void number() {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + text);
        }
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        // primes are allowed inside identifiers: x', acc''
        return isAlpha(c) || isDigit(c) || c == '\'';
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private RuntimeException error(String msg) {
        return new RuntimeException("[line " + line + "] " + msg);
    }
}
