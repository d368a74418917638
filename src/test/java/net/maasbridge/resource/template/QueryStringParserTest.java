package net.maasbridge.resource.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class QueryStringParserTest {

    @ParameterizedTest
    @NullAndEmptySource
    void shouldReturnEmptyMapForMissingQuery(String raw) {
        assertThat(QueryStringParser.parse(raw)).isEmpty();
    }

    @Test
    void shouldPercentDecodeKeysAndValues() {
        Map<String, String> query = QueryStringParser.parse("host%5Fname=web%2001&tags=a+b");

        assertThat(query)
                .containsEntry("host_name", "web 01")
                .containsEntry("tags", "a b");
    }

    @Test
    void repeatedKeys_lastValueWins() {
        Map<String, String> query = QueryStringParser.parse("zone=a&zone=b&zone=c");

        assertThat(query).containsExactly(Map.entry("zone", "c"));
    }

    @Test
    void shouldMapBareKeysToEmptyString() {
        assertThat(QueryStringParser.parse("verbose&limit=5"))
                .containsEntry("verbose", "")
                .containsEntry("limit", "5");
    }

    @Test
    void shouldSkipEmptyPairsAndEmptyKeys() {
        assertThat(QueryStringParser.parse("&&=orphan&limit=5&")).containsExactly(Map.entry("limit", "5"));
    }

    @Test
    void shouldKeepMalformedEscapesAsTyped() {
        assertThat(QueryStringParser.parse("name=100%zz")).containsEntry("name", "100%zz");
    }

    @Test
    void shouldPreserveParameterOrderAndBeImmutable() {
        Map<String, String> query = QueryStringParser.parse("b=2&a=1");

        assertThat(query.keySet()).containsExactly("b", "a");
        assertThatThrownBy(() -> query.put("c", "3")).isInstanceOf(UnsupportedOperationException.class);
    }
}
