package com.challenges.stagedb.statement;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quote-aware helpers for cutting statement text apart. Single and double quotes both
 * open a literal; a doubled quote inside a literal is an escaped quote.
 */
public final class SqlText {

    private SqlText() {
    }

    /**
     * Copy of {@code text} with every character inside a quoted literal (quotes included)
     * replaced by a space, so offsets stay valid and keyword searches skip literals.
     */
    public static String maskQuoted(String text) {
        StringBuilder masked = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                        masked.append("  ");
                        i++;
                        continue;
                    }
                    quote = 0;
                }
                masked.append(' ');
            } else if (c == '\'' || c == '"') {
                quote = c;
                masked.append(' ');
            } else {
                masked.append(c);
            }
        }
        return masked.toString();
    }

    /**
     * Offset of the first match of {@code keyword} outside quoted literals, or -1.
     */
    public static int indexOfKeyword(String text, Pattern keyword) {
        Matcher matcher = keyword.matcher(maskQuoted(text));
        return matcher.find() ? matcher.start() : -1;
    }

    /**
     * Splits on {@code separator} where it is outside quotes and parentheses. Pieces are
     * trimmed; quotes are kept so literal inference can tell {@code '42'} from {@code 42}.
     */
    public static ImmutableList<String> splitTopLevel(String text, char separator) {
        MutableList<String> parts = Lists.mutable.empty();
        String masked = maskQuoted(text);
        int depth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts.toImmutable();
    }

    /**
     * Splits on runs of whitespace outside quotes.
     */
    public static ImmutableList<String> splitWords(String text) {
        MutableList<String> words = Lists.mutable.empty();
        String masked = maskQuoted(text);
        int start = -1;
        for (int i = 0; i < masked.length(); i++) {
            if (Character.isWhitespace(masked.charAt(i))) {
                if (start >= 0) {
                    words.add(text.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            words.add(text.substring(start));
        }
        return words.toImmutable();
    }

    /**
     * Splits a VALUES section such as {@code (1, 'a'), (2, 'b')} into the inner text of
     * each parenthesised tuple. Tuples are separated by {@code ) , (} boundaries found
     * outside quotes.
     *
     * @throws StatementSyntaxException if the section is not a comma-separated list of tuples
     */
    public static ImmutableList<String> splitTuples(String section) {
        MutableList<String> tuples = Lists.mutable.empty();
        String masked = maskQuoted(section);
        int i = skipWhitespace(masked, 0);

        while (i < masked.length()) {
            if (masked.charAt(i) != '(') {
                throw new StatementSyntaxException("Invalid VALUES syntax near: " + section.substring(i).trim(),
                    "VALUES (value, ...) [, (value, ...) ...]");
            }
            int depth = 0;
            int close = -1;
            for (int j = i; j < masked.length(); j++) {
                char c = masked.charAt(j);
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth == 0) {
                    close = j;
                    break;
                }
            }
            if (close < 0) {
                throw new StatementSyntaxException("Unclosed VALUES tuple: " + section.substring(i).trim());
            }
            tuples.add(section.substring(i + 1, close));

            i = skipWhitespace(masked, close + 1);
            if (i < masked.length()) {
                if (masked.charAt(i) != ',') {
                    throw new StatementSyntaxException("Expected ',' between VALUES tuples near: " + section.substring(i).trim());
                }
                i = skipWhitespace(masked, i + 1);
                if (i >= masked.length()) {
                    throw new StatementSyntaxException("Trailing ',' after VALUES tuples");
                }
            }
        }

        if (tuples.isEmpty()) {
            throw new StatementSyntaxException("Missing VALUES tuple", "VALUES (value, ...)");
        }
        return tuples.toImmutable();
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
