package io.shapestreams.server.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringTest {

    @Test
    void parseDecodesKeysAndValues() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/v1/shape/items?offset=%2D1&where=value%20%3D%20%27a%27"));
        assertThat(parsed).containsEntry("offset", "-1");
        assertThat(parsed).containsEntry("where", "value = 'a'");
    }

    @Test
    void parseHandlesMissingValueAsEmpty() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/v1/shape/items?offset=0_0&live"));
        assertThat(parsed).containsEntry("live", "");
    }

    @Test
    void parseKeepsFirstValueOfRepeatedKey() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/v1/shape/items?offset=-1&offset=3_0"));
        assertThat(parsed).containsEntry("offset", "-1");
    }

    @Test
    void parseWithoutQueryIsEmpty() {
        assertThat(QueryString.parse(URI.create("http://localhost/v1/shape/items"))).isEmpty();
    }

    @Test
    void hasDuplicateDetectsRepeatedKeys() {
        assertThat(QueryString.hasDuplicate(URI.create("http://localhost/v1/shape/items?offset=-1&offset=0_0"), "offset"))
                .isTrue();
        assertThat(QueryString.hasDuplicate(URI.create("http://localhost/v1/shape/items?offset=-1&shape_id=x"), "offset"))
                .isFalse();
    }

    @Test
    void hasDuplicateDecodesKeysBeforeComparing() {
        assertThat(QueryString.hasDuplicate(URI.create("http://localhost/v1/shape/items?off%73et=-1&offset=0_0"), "offset"))
                .isTrue();
    }
}
