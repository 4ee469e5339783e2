package io.shapestreams.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Row filter of a shape.
 *
 * <p>Only a conjunction of simple comparisons is understood:
 * <pre>{@code
 * status = 'open' AND owner <> 'bot' AND deleted_at IS NULL
 * }</pre>
 * Literals are single quoted strings ({@code ''} escapes a quote); identifiers are bare or double quoted.
 * Comparisons follow SQL null semantics: a null column never satisfies {@code =} or {@code <>}.
 */
public final class WhereClause {

    /** Filter that accepts every row. */
    public static final WhereClause ALL = new WhereClause("", List.of());

    public enum Operator { EQ, NEQ, IS_NULL, IS_NOT_NULL }

    public record Term(String column, Operator operator, String literal) {
        public Term {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(operator, "operator");
        }

        boolean test(Map<String, String> row) {
            String v = row.get(column);
            return switch (operator) {
                case EQ -> v != null && v.equals(literal);
                case NEQ -> v != null && !v.equals(literal);
                case IS_NULL -> v == null;
                case IS_NOT_NULL -> v != null;
            };
        }
    }

    private final String source;
    private final List<Term> terms;

    private WhereClause(String source, List<Term> terms) {
        this.source = source;
        this.terms = List.copyOf(terms);
    }

    /**
     * Parses a filter expression. A null or blank expression yields {@link #ALL}.
     *
     * @throws IllegalArgumentException describing the first syntax error
     */
    public static WhereClause parse(String expression) {
        if (expression == null || expression.isBlank()) return ALL;
        List<String> tokens = tokenize(expression);
        List<Term> terms = new ArrayList<>();
        int i = 0;
        while (true) {
            if (i >= tokens.size()) throw new IllegalArgumentException("expected column name");
            String column = identifier(tokens.get(i++));
            if (i >= tokens.size()) throw new IllegalArgumentException("expected operator after " + column);
            String op = tokens.get(i++);
            if (op.equals("=") || op.equals("<>") || op.equals("!=")) {
                if (i >= tokens.size()) throw new IllegalArgumentException("expected literal after " + op);
                String lit = literal(tokens.get(i++));
                terms.add(new Term(column, op.equals("=") ? Operator.EQ : Operator.NEQ, lit));
            } else if (op.equalsIgnoreCase("IS")) {
                if (i < tokens.size() && tokens.get(i).equalsIgnoreCase("NOT")) {
                    i++;
                    expectKeyword(tokens, i++, "NULL");
                    terms.add(new Term(column, Operator.IS_NOT_NULL, null));
                } else {
                    expectKeyword(tokens, i++, "NULL");
                    terms.add(new Term(column, Operator.IS_NULL, null));
                }
            } else {
                throw new IllegalArgumentException("unsupported operator " + op);
            }
            if (i >= tokens.size()) break;
            expectKeyword(tokens, i++, "AND");
        }
        return new WhereClause(expression.trim(), terms);
    }

    public boolean matches(Map<String, String> row) {
        for (Term t : terms) {
            if (!t.test(row)) return false;
        }
        return true;
    }

    public boolean isAll() {
        return terms.isEmpty();
    }

    public List<Term> terms() {
        return terms;
    }

    /** Columns referenced by the filter, in order of first appearance. */
    public Set<String> columns() {
        Set<String> out = new LinkedHashSet<>();
        for (Term t : terms) out.add(t.column());
        return out;
    }

    public String source() {
        return source;
    }

    private static void expectKeyword(List<String> tokens, int i, String keyword) {
        if (i >= tokens.size() || !tokens.get(i).equalsIgnoreCase(keyword)) {
            throw new IllegalArgumentException("expected " + keyword);
        }
    }

    private static String identifier(String token) {
        if (token.startsWith("\"")) return token.substring(1, token.length() - 1).replace("\"\"", "\"");
        if (token.startsWith("'")) throw new IllegalArgumentException("expected column name but got literal");
        if (!Character.isLetter(token.charAt(0)) && token.charAt(0) != '_') {
            throw new IllegalArgumentException("invalid column name " + token);
        }
        return token.toLowerCase(Locale.ROOT);
    }

    private static String literal(String token) {
        if (!token.startsWith("'")) throw new IllegalArgumentException("expected quoted literal but got " + token);
        return token.substring(1, token.length() - 1).replace("''", "'");
    }

    private static List<String> tokenize(String s) {
        List<String> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                int end = closingQuote(s, i, c);
                out.add(s.substring(i, end + 1));
                i = end + 1;
            } else if (c == '=') {
                out.add("=");
                i++;
            } else if ((c == '<' || c == '!') && i + 1 < s.length()
                    && (s.charAt(i + 1) == '>' || s.charAt(i + 1) == '=')) {
                out.add(s.substring(i, i + 2));
                i += 2;
            } else {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
                if (start == i) throw new IllegalArgumentException("unexpected character '" + c + "'");
                out.add(s.substring(start, i));
            }
        }
        return out;
    }

    private static int closingQuote(String s, int open, char quote) {
        int i = open + 1;
        while (i < s.length()) {
            if (s.charAt(i) == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        throw new IllegalArgumentException("unterminated quoted token");
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof WhereClause)) return false;
        return terms.equals(((WhereClause) other).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
