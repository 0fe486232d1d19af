package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.ast.AstNode;
import com.spreadsheet.formula.engine.ast.BinaryOpNode;
import com.spreadsheet.formula.engine.ast.CellRefNode;
import com.spreadsheet.formula.engine.ast.FunctionCallNode;
import com.spreadsheet.formula.engine.ast.LiteralNode;
import com.spreadsheet.formula.engine.ast.RangeRefNode;
import com.spreadsheet.formula.engine.ast.UnaryOpNode;
import com.spreadsheet.formula.exceptions.ParseException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Recursive-descent parser over the lexer's tokens.
 *
 * <pre>
 * comparison     : additive ( ( "=" | "&lt;" | "&gt;" | "&lt;=" | "&gt;=" | "&lt;&gt;" ) additive )* ;
 * additive       : multiplicative ( ( "+" | "-" ) multiplicative )* ;
 * multiplicative : power ( ( "*" | "/" | "%" ) power )* ;
 * power          : unary ( "^" unary )* ;
 * unary          : ( "+" | "-" ) unary | primary ;
 * primary        : NUMBER | STRING | CELL_REF | RANGE_REF
 *                | FUNCTION "(" ( comparison ( "," comparison )* )? ")"
 *                | "(" comparison ")" ;
 * </pre>
 *
 * Every binary tier is left-associative. Function arity is not checked here;
 * the evaluator does that against the registry. Nesting is limited to
 * {@link #MAX_NESTING_DEPTH} levels.
 */
public final class FormulaParser {

    private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

    private static final List<String> COMPARISON_OPERATORS = Arrays.asList("=", "<", ">", "<=", ">=", "<>");
    private static final List<String> ADDITIVE_OPERATORS = Arrays.asList("+", "-");
    private static final List<String> MULTIPLICATIVE_OPERATORS = Arrays.asList("*", "/", "%");
    private static final List<String> POWER_OPERATORS = Arrays.asList("^");

    // Parentheses, function calls and unary signs nested deeper than this are rejected
    static final int MAX_NESTING_DEPTH = 256;

    /**
     * Parses the whole token sequence into one expression; leftover tokens are an error.
     */
    public AstNode parse(List<Token> tokens) {
        log.debug("Parsing tokens: {}", tokens);
        Descent descent = new Descent(tokens);
        AstNode root = descent.comparison();
        if (descent.hasMore()) {
            Token extra = descent.peek();
            throw new ParseException("Unexpected " + extra.getType() + " '" + extra.getText()
                    + "' at position " + extra.getPosition(), "end of formula");
        }
        return root;
    }

    /**
     * Cursor over one token list; a new instance per parse call.
     */
    private static final class Descent {
        private final List<Token> tokens;
        private int pos;
        private int depth;

        Descent(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean hasMore() {
            return pos < tokens.size();
        }

        Token peek() {
            return hasMore() ? tokens.get(pos) : null;
        }

        boolean check(TokenType type) {
            return hasMore() && tokens.get(pos).is(type);
        }

        // Consumes the next token if it is one of the given operators
        Token matchOperator(List<String> operators) {
            Token token = peek();
            if (token != null && token.is(TokenType.OPERATOR) && operators.contains(token.getText())) {
                pos++;
                return token;
            }
            return null;
        }

        void enter() {
            if (++depth > MAX_NESTING_DEPTH) {
                throw new ParseException("Formula nested deeper than " + MAX_NESTING_DEPTH + " levels",
                        "shallower expression");
            }
        }

        AstNode comparison() {
            enter();
            AstNode left = additive();
            Token op;
            while ((op = matchOperator(COMPARISON_OPERATORS)) != null) {
                left = new BinaryOpNode(op.getText(), left, additive());
            }
            depth--;
            return left;
        }

        AstNode additive() {
            AstNode left = multiplicative();
            Token op;
            while ((op = matchOperator(ADDITIVE_OPERATORS)) != null) {
                left = new BinaryOpNode(op.getText(), left, multiplicative());
            }
            return left;
        }

        AstNode multiplicative() {
            AstNode left = power();
            Token op;
            while ((op = matchOperator(MULTIPLICATIVE_OPERATORS)) != null) {
                left = new BinaryOpNode(op.getText(), left, power());
            }
            return left;
        }

        AstNode power() {
            AstNode left = unary();
            Token op;
            while ((op = matchOperator(POWER_OPERATORS)) != null) {
                left = new BinaryOpNode(op.getText(), left, unary());
            }
            return left;
        }

        AstNode unary() {
            Token op = matchOperator(ADDITIVE_OPERATORS);
            if (op != null) {
                enter();
                AstNode operand = unary();
                depth--;
                return new UnaryOpNode(op.getText(), operand);
            }
            return primary();
        }

        AstNode primary() {
            if (!hasMore()) {
                throw new ParseException("Unexpected end of formula", "expression");
            }
            Token token = tokens.get(pos++);

            switch (token.getType()) {
                case NUMBER:
                    return new LiteralNode(CellValue.number(Double.parseDouble(token.getText())));
                case STRING:
                    return new LiteralNode(CellValue.text(token.getText()));
                case CELL_REF:
                    return new CellRefNode(token.getText());
                case RANGE_REF:
                    return rangeRef(token);
                case FUNCTION_NAME:
                    return functionCall(token);
                case LPAREN:
                    AstNode expr = comparison();
                    if (!check(TokenType.RPAREN)) {
                        throw new ParseException("Expected closing parenthesis", ")");
                    }
                    pos++;
                    return expr;
                default:
                    throw new ParseException("Unexpected " + token.getType() + " '" + token.getText()
                            + "' at position " + token.getPosition(), "expression");
            }
        }

        AstNode rangeRef(Token token) {
            String[] corners = token.getText().split(":", -1);
            if (corners.length != 2 || !CellAddress.isAddress(corners[0]) || !CellAddress.isAddress(corners[1])) {
                throw new ParseException("Malformed range '" + token.getText() + "' at position "
                        + token.getPosition(), "ADDRESS:ADDRESS");
            }
            return new RangeRefNode(corners[0], corners[1]);
        }

        AstNode functionCall(Token nameToken) {
            String name = nameToken.getText();
            if (!check(TokenType.LPAREN)) {
                throw new ParseException("Expected '(' after function " + name, "(");
            }
            pos++;

            List<AstNode> args = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                // Running out of tokens here surfaces as "Unexpected end of formula"
                args.add(comparison());
                while (check(TokenType.COMMA)) {
                    pos++;
                    args.add(comparison());
                }
            }

            if (!check(TokenType.RPAREN)) {
                throw new ParseException("Expected ')' after function " + name + " arguments", ")");
            }
            pos++;
            return new FunctionCallNode(name, args);
        }
    }
}
