package net.maasbridge.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class IdGeneratorTest {

    @Test
    void requestIdsAreBase62AndDistinct() {
        String first = IdGenerator.requestId();
        String second = IdGenerator.requestId();

        assertThat(first).hasSize(12).matches("[0-9a-zA-Z]+");
        assertThat(first).isNotEqualTo(second);
        assertThatThrownBy(() -> IdGenerator.generate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
