package io.shapestreams.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhereClauseTest {

    @Test
    void blankFilterAcceptsEverything() {
        assertThat(WhereClause.parse(null)).isSameAs(WhereClause.ALL);
        assertThat(WhereClause.parse("  ")).isSameAs(WhereClause.ALL);
        assertThat(WhereClause.ALL.matches(Map.of("a", "1"))).isTrue();
    }

    @Test
    void matchesConjunctionOfComparisons() {
        WhereClause where = WhereClause.parse("status = 'open' AND owner <> 'bot' and deleted_at IS NULL");

        assertThat(where.columns()).containsExactly("status", "owner", "deleted_at");
        assertThat(where.matches(row("status", "open", "owner", "ann", "deleted_at", null))).isTrue();
        assertThat(where.matches(row("status", "open", "owner", "bot", "deleted_at", null))).isFalse();
        assertThat(where.matches(row("status", "closed", "owner", "ann", "deleted_at", null))).isFalse();
        assertThat(where.matches(row("status", "open", "owner", "ann", "deleted_at", "2024-01-01"))).isFalse();
    }

    @Test
    void nullNeverSatisfiesEqualityOrInequality() {
        assertThat(WhereClause.parse("a = 'x'").matches(row("a", null))).isFalse();
        assertThat(WhereClause.parse("a != 'x'").matches(row("a", null))).isFalse();
        assertThat(WhereClause.parse("a IS NOT NULL").matches(row("a", "x"))).isTrue();
    }

    @Test
    void handlesQuotingAndCase() {
        WhereClause where = WhereClause.parse("\"Title\" = 'it''s'");
        assertThat(where.terms()).containsExactly(new WhereClause.Term("Title", WhereClause.Operator.EQ, "it's"));

        assertThat(WhereClause.parse("STATUS = 'a'").columns()).containsExactly("status");
    }

    @Test
    void equalFiltersShareIdentity() {
        assertThat(WhereClause.parse("a = 'x' AND b IS NULL"))
                .isEqualTo(WhereClause.parse("a='x' and b is null"))
                .hasSameHashCodeAs(WhereClause.parse("a='x' and b is null"));
    }

    @Test
    void reportsSyntaxErrors() {
        assertThatThrownBy(() -> WhereClause.parse("a = 1")).hasMessageContaining("expected quoted literal");
        assertThatThrownBy(() -> WhereClause.parse("a > 'x'")).hasMessageContaining("unexpected character");
        assertThatThrownBy(() -> WhereClause.parse("a = 'x' OR b = 'y'")).hasMessage("expected AND");
        assertThatThrownBy(() -> WhereClause.parse("a = 'x")).hasMessage("unterminated quoted token");
        assertThatThrownBy(() -> WhereClause.parse("a IS")).hasMessage("expected NULL");
    }

    private static Map<String, String> row(String... kv) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) out.put(kv[i], kv[i + 1]);
        return out;
    }
}
