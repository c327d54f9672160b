package com.ciro.jluax.render;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseKindTest {

    @Test
    void byNameIsCaseInsensitive() {
        assertThat(ResponseKind.byName("page")).isEqualTo(ResponseKind.PAGE);
        assertThat(ResponseKind.byName(" Fragment ")).isEqualTo(ResponseKind.FRAGMENT);
        assertThat(ResponseKind.byName("xml")).isNull();
    }

    @Test
    void inference() {
        assertThat(ResponseKind.infer(Map.of("tag", "p"))).isEqualTo(ResponseKind.PAGE);
        assertThat(ResponseKind.infer(Map.of("id", 1))).isEqualTo(ResponseKind.JSON);
        assertThat(ResponseKind.infer(List.of(1))).isEqualTo(ResponseKind.JSON);
        assertThat(ResponseKind.infer("<p/>")).isEqualTo(ResponseKind.FRAGMENT);
        assertThat(ResponseKind.infer(3)).isEqualTo(ResponseKind.TEXT);
        assertThat(ResponseKind.infer(null)).isEqualTo(ResponseKind.TEXT);
    }

    @Test
    void contentTypes() {
        assertThat(ResponseKind.PAGE.contentType()).startsWith("text/html");
        assertThat(ResponseKind.JSON.contentType()).isEqualTo("application/json");
        assertThat(ResponseKind.TEXT.contentType()).startsWith("text/plain");
    }
}
