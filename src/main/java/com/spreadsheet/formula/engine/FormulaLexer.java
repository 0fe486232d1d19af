package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.LexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns formula text into tokens. Stateless: every call is independent.
 * Identifiers are upper-cased, so "sum(a1)" lexes like "SUM(A1)", and "$"
 * markers of absolute references are dropped from reference tokens.
 */
public final class FormulaLexer {

    private static final Logger log = LoggerFactory.getLogger(FormulaLexer.class);

    private static final Pattern CELL_REF_PATTERN = Pattern.compile("^[A-Z]+[0-9]+$");
    private static final Pattern ABSOLUTE_REF_PATTERN = Pattern.compile("^\\$?[A-Z]+\\$?[0-9]+$");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/^=><%";

    public List<Token> tokenize(String formula) {
        log.debug("Tokenizing formula: \"{}\"", formula);
        List<Token> tokens = new ArrayList<>();
        // Remove leading "=" but keep offsets relative to the text we were given
        int i = formula.startsWith("=") ? 1 : 0;

        while (i < formula.length()) {
            char c = formula.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (isDigit(c) || (c == '.' && i + 1 < formula.length() && isDigit(formula.charAt(i + 1)))) {
                i = readNumber(formula, i, tokens);
                continue;
            }

            if (c == '"') {
                i = readString(formula, i, tokens);
                continue;
            }

            if (isLetter(c) || c == '$') {
                i = readIdentifier(formula, i, tokens);
                continue;
            }

            if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
                // Two-char operators (>=, <=, <>) need one char of lookahead
                if (i + 1 < formula.length()) {
                    char next = formula.charAt(i + 1);
                    if ((c == '>' || c == '<') && next == '=') {
                        tokens.add(new Token(TokenType.OPERATOR, "" + c + next, i));
                        i += 2;
                        continue;
                    }
                    if (c == '<' && next == '>') {
                        tokens.add(new Token(TokenType.OPERATOR, "<>", i));
                        i += 2;
                        continue;
                    }
                }
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i));
                i++;
                continue;
            }

            switch (c) {
                case '(':
                    tokens.add(new Token(TokenType.LPAREN, "(", i));
                    break;
                case ')':
                    tokens.add(new Token(TokenType.RPAREN, ")", i));
                    break;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ",", i));
                    break;
                case ':':
                    tokens.add(new Token(TokenType.COLON, ":", i));
                    break;
                default:
                    throw new LexException(c, i);
            }
            i++;
        }

        return tokens;
    }

    // A maximal run of digits with at most one decimal point
    private int readNumber(String formula, int start, List<Token> tokens) {
        int i = start;
        boolean seenPoint = false;
        while (i < formula.length()) {
            char c = formula.charAt(i);
            if (c == '.' && !seenPoint) {
                seenPoint = true;
            } else if (!isDigit(c)) {
                break;
            }
            i++;
        }
        tokens.add(new Token(TokenType.NUMBER, formula.substring(start, i), start));
        return i;
    }

    private int readString(String formula, int start, List<Token> tokens) {
        int end = formula.indexOf('"', start + 1);
        if (end < 0) {
            throw new LexException("Unterminated string starting at position " + start, '"', start);
        }
        tokens.add(new Token(TokenType.STRING, formula.substring(start + 1, end), start));
        return end + 1;
    }

    private int readIdentifier(String formula, int start, List<Token> tokens) {
        int i = start;
        while (i < formula.length() && isIdentifierPart(formula.charAt(i))) {
            i++;
        }
        String raw = formula.substring(start, i).toUpperCase();

        if (raw.indexOf(':') >= 0) {
            String[] corners = raw.split(":", -1);
            for (String corner : corners) {
                checkAbsoluteMarkers(formula, start, corner);
            }
            tokens.add(new Token(TokenType.RANGE_REF, raw.replace("$", ""), start));
        } else if (CELL_REF_PATTERN.matcher(raw.replace("$", "")).matches()) {
            checkAbsoluteMarkers(formula, start, raw);
            tokens.add(new Token(TokenType.CELL_REF, raw.replace("$", ""), start));
        } else {
            checkAbsoluteMarkers(formula, start, raw);
            tokens.add(new Token(TokenType.FUNCTION_NAME, raw, start));
        }
        return i;
    }

    // "$" may only pin the column and/or row of a reference
    private void checkAbsoluteMarkers(String formula, int start, String part) {
        if (part.indexOf('$') >= 0 && !ABSOLUTE_REF_PATTERN.matcher(part).matches()) {
            int offset = formula.indexOf('$', start);
            throw new LexException('$', offset);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isIdentifierPart(char c) {
        return isLetter(c) || isDigit(c) || c == ':' || c == '$' || c == '_';
    }
}
