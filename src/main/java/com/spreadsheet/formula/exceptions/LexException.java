package com.spreadsheet.formula.exceptions;

/**
 * Thrown when the lexer meets a character it has no token for,
 * e.g. "Unexpected character: & at position 3".
 */
public class LexException extends FormulaException {
    private final char character;
    private final int position;

    public LexException(char character, int position) {
        super("Unexpected character: " + character + " at position " + position);
        this.character = character;
        this.position = position;
    }

    public LexException(String message, char character, int position) {
        super(message);
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
