package com.subreq.crosswalk;

import com.subreq.code.CodeSet;
import com.subreq.crosswalk.expression.ExpressionTokenizer;
import com.subreq.crosswalk.expression.Token;
import com.subreq.crosswalk.expression.TokenType;
import com.subreq.exception.MalformedExpressionException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.subreq.crosswalk.expression.ExpressionConfig.MAX_AND_GROUPS;

/**
 * Expands a normalized eligibility expression into one code set per concrete
 * AND-combination.
 * <p>
 * Shape accepted:
 * <pre>
 * expression  := alternative ('or' alternative)*      -- 'or' outside parentheses
 * alternative := slot ('&amp;' slot){0,3}
 * slot        := codes, parentheses allowed; only the first slot may contain 'or'
 * </pre>
 * {@code (H or S) & c & h} therefore yields {@code {H,c,h}} and {@code {S,c,h}}.
 * Parentheses only group; they are stripped once the structure is known.
 * UNKNOWN tokens contribute no code and are counted.
 */
public final class CrosswalkExpander {

    private CrosswalkExpander() {
    }

    /**
     * Expand a single expression.
     *
     * @param expression Normalized expression, already split by {@link ComboSplitter}
     * @return Distinct code sets in first-seen order and the number of unknown tokens
     * @throws MalformedExpressionException if the expression has an unsupported shape
     */
    public static Expansion expand(NormalizedExpression expression) {
        String input = expression.text();
        List<Token> tokens = new ExpressionTokenizer(input).tokenize();
        List<Token> body = tokens.subList(0, tokens.size() - 1);

        validateParentheses(input, body);

        int unknown = (int) body.stream().filter(t -> t.type() == TokenType.UNKNOWN).count();
        if (body.isEmpty()) {
            return new Expansion(List.of(CodeSet.empty()), 0);
        }

        Set<CodeSet> codeSets = new LinkedHashSet<>();
        for (List<Token> alternative : splitTopLevelAlternatives(input, body)) {
            codeSets.addAll(expandAlternative(input, alternative));
        }
        return new Expansion(List.copyOf(codeSets), unknown);
    }

    private static void validateParentheses(String input, List<Token> tokens) {
        int depth = 0;
        for (Token token : tokens) {
            if (token.type() == TokenType.LPAREN) {
                depth++;
            } else if (token.type() == TokenType.RPAREN) {
                depth--;
                if (depth < 0) {
                    throw new MalformedExpressionException("Unbalanced ')'", input, token.position());
                }
            }
        }
        if (depth != 0) {
            throw new MalformedExpressionException("Unclosed '('", input, input.length());
        }
    }

    private static List<List<Token>> splitTopLevelAlternatives(String input, List<Token> tokens) {
        List<List<Token>> alternatives = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token token : tokens) {
            if (token.type() == TokenType.LPAREN) {
                depth++;
            } else if (token.type() == TokenType.RPAREN) {
                depth--;
            }
            if (token.type() == TokenType.OR && depth == 0) {
                alternatives.add(requireContent(input, current, token.position(), "Empty alternative before 'or'"));
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        alternatives.add(requireContent(input, current, input.length(), "Empty alternative after 'or'"));
        return alternatives;
    }

    private static List<CodeSet> expandAlternative(String input, List<Token> alternative) {
        List<List<Token>> slots = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : alternative) {
            if (token.type() == TokenType.AND) {
                slots.add(requireContent(input, current, token.position(), "Empty AND-group before '&'"));
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        slots.add(requireContent(input, current, input.length(), "Empty AND-group after '&'"));

        if (slots.size() > MAX_AND_GROUPS) {
            throw new MalformedExpressionException("More than " + MAX_AND_GROUPS + " AND-groups",
                    input, alternative.get(0).position());
        }

        CodeSet rest = CodeSet.empty();
        for (List<Token> slot : slots.subList(1, slots.size())) {
            for (Token token : slot) {
                if (token.type() == TokenType.OR) {
                    throw new MalformedExpressionException(
                            "'or' is only supported in the first AND-group", input, token.position());
                }
            }
            rest = rest.union(codesOf(slot));
        }

        List<CodeSet> rows = new ArrayList<>();
        for (List<Token> option : splitFirstSlot(input, slots.get(0))) {
            rows.add(codesOf(option).union(rest));
        }
        return rows;
    }

    private static List<List<Token>> splitFirstSlot(String input, List<Token> slot) {
        List<List<Token>> options = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : slot) {
            if (token.type() == TokenType.OR) {
                options.add(requireContent(input, current, token.position(), "Empty alternative before 'or'"));
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        options.add(requireContent(input, current, input.length(), "Empty alternative after 'or'"));
        return options;
    }

    private static CodeSet codesOf(List<Token> tokens) {
        CodeSet codes = CodeSet.empty();
        for (Token token : tokens) {
            if (token.type() == TokenType.CODE) {
                codes = codes.with(token.code());
            }
        }
        return codes;
    }

    private static List<Token> requireContent(String input, List<Token> tokens, int position, String message) {
        boolean hasContent = tokens.stream()
                .anyMatch(t -> t.type() == TokenType.CODE || t.type() == TokenType.UNKNOWN);
        if (!hasContent) {
            throw new MalformedExpressionException(message, input, position);
        }
        return tokens;
    }

    /**
     * Result of expanding one expression.
     *
     * @param codeSets      One code set per AND-combination, never empty
     * @param unknownTokens Tokens that were neither a code nor an operator
     */
    public record Expansion(List<CodeSet> codeSets, int unknownTokens) {
    }
}
