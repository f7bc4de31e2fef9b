package com.challenges.stagedb.predicate;

import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Locale;

/**
 * Recursive-descent parser for WHERE clauses.
 *
 * <pre>
 * or    := and (OR or)?
 * and   := term (AND and)?
 * term  := '(' or ')' | leaf
 * leaf  := col IS [NOT] NULL | col BETWEEN lit AND lit | col IN (lit, ...)
 *        | col LIKE lit | col cmp lit
 * </pre>
 *
 * OR binds loosest. BETWEEN consumes its own AND inside the leaf production, so that AND
 * is never taken for a combinator. Chains nest to the right: {@code a OR b OR c} is
 * {@code a OR (b OR c)}.
 */
public class PredicateParser {
    private static final ImmutableSet<String> RESERVED =
        Sets.immutable.with("AND", "OR", "NOT", "IS", "NULL", "IN", "LIKE", "BETWEEN");

    private final ClauseTokenizer tokenizer = new ClauseTokenizer();

    public Predicate parse(String clause) {
        if (clause == null || clause.isBlank()) {
            throw new PredicateSyntaxException("Empty WHERE clause", String.valueOf(clause));
        }
        return new Cursor(clause, tokenizer.tokenize(clause)).parseClause();
    }

    /**
     * Parse state over one clause's tokens.
     */
    private static final class Cursor {
        private final String clause;
        private final ImmutableList<Token> tokens;
        private int position;

        Cursor(String clause, ImmutableList<Token> tokens) {
            this.clause = clause;
            this.tokens = tokens;
        }

        Predicate parseClause() {
            Predicate predicate = parseOr();
            if (position < tokens.size()) {
                throw error("Unexpected input", position);
            }
            return predicate;
        }

        private Predicate parseOr() {
            Predicate left = parseAnd();
            if (peekKeyword("OR")) {
                position++;
                return new Predicate.Branch(left, Combinator.OR, parseOr());
            }
            return left;
        }

        private Predicate parseAnd() {
            Predicate left = parseTerm();
            if (peekKeyword("AND")) {
                position++;
                return new Predicate.Branch(left, Combinator.AND, parseAnd());
            }
            return left;
        }

        private Predicate parseTerm() {
            if (peek(Token.Kind.LEFT_PAREN)) {
                int open = position;
                position++;
                Predicate inner = parseOr();
                if (!peek(Token.Kind.RIGHT_PAREN)) {
                    throw error("Missing closing parenthesis", open);
                }
                position++;
                return inner;
            }
            return parseLeaf();
        }

        private Predicate parseLeaf() {
            int leafStart = position;
            Token column = next(leafStart, "Expected column name");
            if (column.kind() != Token.Kind.WORD || isReserved(column)) {
                throw error("Expected column name", leafStart);
            }

            Token operator = next(leafStart, "Expected operator after column '" + column.text() + "'");

            if (operator.isKeyword("IS")) {
                boolean negated = false;
                if (peekKeyword("NOT")) {
                    position++;
                    negated = true;
                }
                if (!peekKeyword("NULL")) {
                    throw error("Expected NULL after IS", leafStart);
                }
                position++;
                return new Predicate.Leaf(column.text(), negated ? Operator.IS_NOT_NULL : Operator.IS_NULL, null);
            }

            if (operator.isKeyword("BETWEEN")) {
                Object min = literal(leafStart);
                if (!peekKeyword("AND")) {
                    throw error("Expected AND between range bounds", leafStart);
                }
                position++;
                Object max = literal(leafStart);
                return new Predicate.Leaf(column.text(), Operator.BETWEEN, new Predicate.Range(min, max));
            }

            if (operator.isKeyword("IN")) {
                if (!peek(Token.Kind.LEFT_PAREN)) {
                    throw error("Expected '(' after IN", leafStart);
                }
                position++;
                MutableList<Object> values = Lists.mutable.empty();
                values.add(literal(leafStart));
                while (peek(Token.Kind.COMMA)) {
                    position++;
                    values.add(literal(leafStart));
                }
                if (!peek(Token.Kind.RIGHT_PAREN)) {
                    throw error("Expected ')' to close IN list", leafStart);
                }
                position++;
                return new Predicate.Leaf(column.text(), Operator.IN, values.toImmutable());
            }

            if (operator.isKeyword("LIKE")) {
                return new Predicate.Leaf(column.text(), Operator.LIKE, literal(leafStart));
            }

            if (operator.kind() == Token.Kind.COMPARISON) {
                Operator op = Operator.fromComparison(operator.text());
                return new Predicate.Leaf(column.text(), op, literal(leafStart));
            }

            throw error("Invalid WHERE condition", leafStart);
        }

        private Object literal(int leafStart) {
            Token token = next(leafStart, "Expected value");
            return switch (token.kind()) {
                case STRING -> token.text();
                case NUMBER -> Values.parseLiteral(token.text());
                case WORD -> {
                    if (token.isKeyword("NULL")) {
                        yield null;
                    }
                    if (isReserved(token)) {
                        throw error("Expected value", leafStart);
                    }
                    yield token.text();
                }
                default -> throw error("Expected value", leafStart);
            };
        }

        private Token next(int leafStart, String message) {
            if (position >= tokens.size()) {
                throw error(message, leafStart);
            }
            return tokens.get(position++);
        }

        private boolean peek(Token.Kind kind) {
            return position < tokens.size() && tokens.get(position).kind() == kind;
        }

        private boolean peekKeyword(String keyword) {
            return position < tokens.size() && tokens.get(position).isKeyword(keyword);
        }

        private static boolean isReserved(Token token) {
            return token.kind() == Token.Kind.WORD && RESERVED.contains(token.text().toUpperCase(Locale.ROOT));
        }

        /**
         * Builds an error whose fragment runs from the given token up to the next top-level
         * AND/OR (or the end of the clause).
         */
        private PredicateSyntaxException error(String message, int fromToken) {
            if (fromToken >= tokens.size()) {
                return new PredicateSyntaxException(message, clause.trim());
            }
            int start = tokens.get(fromToken).start();
            int end = clause.length();
            int depth = 0;
            boolean inRange = false;
            for (int i = fromToken + 1; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                if (token.kind() == Token.Kind.LEFT_PAREN) {
                    depth++;
                } else if (token.kind() == Token.Kind.RIGHT_PAREN) {
                    depth--;
                } else if (token.isKeyword("BETWEEN")) {
                    inRange = true;
                } else if (depth <= 0 && (token.isKeyword("AND") || token.isKeyword("OR"))) {
                    if (inRange && token.isKeyword("AND")) {
                        inRange = false;
                        continue;
                    }
                    end = token.start();
                    break;
                }
            }
            return new PredicateSyntaxException(message, clause.substring(start, end).trim());
        }
    }
}
