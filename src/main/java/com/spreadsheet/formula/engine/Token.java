package com.spreadsheet.formula.engine;

import java.util.Objects;

/**
 * One lexical unit of a formula. Position is the offset of the token's first
 * character in the formula text as given to the lexer (a leading "=" counts).
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType expectedType) {
        return type == expectedType;
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token token = (Token) o;
        return position == token.position && type == token.type && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, position);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
