package com.subreq.crosswalk.expression;

import com.subreq.code.ConditionCode;

import java.util.ArrayList;
import java.util.List;

import static com.subreq.crosswalk.expression.ExpressionConfig.*;

/**
 * Tokenizer for normalized eligibility expressions.
 * <p>
 * A run of ASCII letters is the keyword {@code or}, a sequence of adjacent code
 * symbols (one CODE token each), or an UNKNOWN token. Non-ASCII code symbols are
 * always single tokens. Anything else that is not whitespace, {@code &} or a
 * parenthesis is read as an UNKNOWN token.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.AND -> {
                    advance();
                    tokens.add(new Token(TokenType.AND, "&", null, start));
                }
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                default -> {
                    if (isAsciiLetter(c)) {
                        readWord(tokens);
                    } else if (ConditionCode.isSymbol(c)) {
                        advance();
                        tokens.add(new Token(TokenType.CODE, String.valueOf(c),
                                ConditionCode.fromSymbol(c).orElseThrow(), start));
                    } else {
                        tokens.add(readUnknown());
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private void readWord(List<Token> tokens) {
        int start = pos;
        while (!isAtEnd() && isAsciiLetter(peek())) {
            advance();
        }
        String text = input.substring(start, pos);

        if (text.equalsIgnoreCase(OR_KEYWORD)) {
            tokens.add(new Token(TokenType.OR, text, null, start));
            return;
        }

        if (text.chars().allMatch(ch -> ConditionCode.isSymbol((char) ch))) {
            for (int i = 0; i < text.length(); i++) {
                char symbol = text.charAt(i);
                tokens.add(new Token(TokenType.CODE, String.valueOf(symbol),
                        ConditionCode.fromSymbol(symbol).orElseThrow(), start + i));
            }
            return;
        }

        tokens.add(new Token(TokenType.UNKNOWN, text, null, start));
    }

    private Token readUnknown() {
        int start = pos;
        while (!isAtEnd() && !isBoundary(peek())) {
            advance();
        }
        return new Token(TokenType.UNKNOWN, input.substring(start, pos), null, start);
    }

    private boolean isBoundary(char c) {
        return Character.isWhitespace(c)
                || c == Operators.AND
                || c == Operators.LEFT_PAREN
                || c == Operators.RIGHT_PAREN
                || isAsciiLetter(c)
                || ConditionCode.isSymbol(c);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
