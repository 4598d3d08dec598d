package com.arbor.hierarchy.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IdChainEncoding")
class IdChainEncodingTest {

    @Test
    @DisplayName("delimits every id with slashes")
    void encodes() {
        assertThat(IdChainEncoding.encode(List.of("a", "b"))).isEqualTo("/a/b/");
        assertThat(IdChainEncoding.decode("/a/b/")).containsExactly("a", "b");
        assertThat(IdChainEncoding.decode("/")).isEmpty();
    }

    @Test
    @DisplayName("escapes LIKE wildcards and the escape character")
    void escapesLike() {
        assertThat(IdChainEncoding.escapeLike("50%_off\\")).isEqualTo("50\\%\\_off\\\\");
    }
}
