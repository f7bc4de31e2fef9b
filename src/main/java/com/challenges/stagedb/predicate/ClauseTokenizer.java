package com.challenges.stagedb.predicate;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits a WHERE clause into tokens. Quoted literals become a single STRING token
 * (quotes stripped, doubled quotes unescaped), so keywords inside them are never seen
 * by the parser.
 */
public class ClauseTokenizer {

    public ImmutableList<Token> tokenize(String clause) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int i = 0;
        int length = clause.length();

        while (i < length) {
            char c = clause.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                i = readString(clause, i, tokens);
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < length && Character.isDigit(clause.charAt(i + 1)))) {
                i = readNumber(clause, i, tokens);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && isWordPart(clause.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Token.Kind.WORD, clause.substring(start, i), start, i));
            } else if (c == '(') {
                tokens.add(new Token(Token.Kind.LEFT_PAREN, "(", i, i + 1));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Token.Kind.RIGHT_PAREN, ")", i, i + 1));
                i++;
            } else if (c == ',') {
                tokens.add(new Token(Token.Kind.COMMA, ",", i, i + 1));
                i++;
            } else if (c == '=' || c == '<' || c == '>' || c == '!') {
                i = readComparison(clause, i, tokens);
            } else {
                throw new PredicateSyntaxException("Unexpected character '" + c + "'", clause.substring(i));
            }
        }

        return tokens.toImmutable();
    }

    private int readString(String clause, int start, MutableList<Token> tokens) {
        char quote = clause.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < clause.length()) {
            char c = clause.charAt(i);
            if (c == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < clause.length() && clause.charAt(i + 1) == quote) {
                    value.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new Token(Token.Kind.STRING, value.toString(), start, i + 1));
                return i + 1;
            }
            value.append(c);
            i++;
        }
        throw new PredicateSyntaxException("Unterminated string literal", clause.substring(start));
    }

    private int readNumber(String clause, int start, MutableList<Token> tokens) {
        int i = start + 1;
        while (i < clause.length() && Character.isDigit(clause.charAt(i))) {
            i++;
        }
        if (i + 1 < clause.length() && clause.charAt(i) == '.' && Character.isDigit(clause.charAt(i + 1))) {
            i++;
            while (i < clause.length() && Character.isDigit(clause.charAt(i))) {
                i++;
            }
        }
        // 12abc is a bare word, not a number followed by a word
        if (i < clause.length() && isWordPart(clause.charAt(i))) {
            while (i < clause.length() && isWordPart(clause.charAt(i))) {
                i++;
            }
            tokens.add(new Token(Token.Kind.WORD, clause.substring(start, i), start, i));
            return i;
        }
        tokens.add(new Token(Token.Kind.NUMBER, clause.substring(start, i), start, i));
        return i;
    }

    private int readComparison(String clause, int start, MutableList<Token> tokens) {
        String two = start + 2 <= clause.length() ? clause.substring(start, start + 2) : "";
        if (two.equals("!=") || two.equals("<>") || two.equals("<=") || two.equals(">=")) {
            tokens.add(new Token(Token.Kind.COMPARISON, two, start, start + 2));
            return start + 2;
        }
        char c = clause.charAt(start);
        if (c == '!') {
            throw new PredicateSyntaxException("Unexpected character '!'", clause.substring(start));
        }
        tokens.add(new Token(Token.Kind.COMPARISON, String.valueOf(c), start, start + 1));
        return start + 1;
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
