package com.ciro.jluax.router;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathPatternTest {

    @Test
    void literalTemplateMatchesOnlyItself() {
        PathPattern p = PathPattern.compile("/about/team");

        assertThat(p.match("/about/team")).isEmpty();
        assertThat(p.match("/about")).isNull();
        assertThat(p.match("/about/team/x")).isNull();
        assertThat(p.match("/About/team")).isNull();
    }

    @Test
    void rootMatchesRootOnly() {
        PathPattern root = PathPattern.compile("/");

        assertThat(root.segments()).isEmpty();
        assertThat(root.match("/")).isEmpty();
        assertThat(root.match("")).isEmpty();
        assertThat(root.match("/x")).isNull();
    }

    @Test
    void namedSegmentsCaptureInTemplateOrder() {
        PathPattern p = PathPattern.compile("/users/:id/orders/:oid");

        Map<String, String> params = p.match("/users/42/orders/7");

        assertThat(params).containsExactly(Map.entry("id", "42"), Map.entry("oid", "7"));
    }

    @Test
    void namedSegmentMayCaptureEmptyComponent() {
        PathPattern p = PathPattern.compile("/users/:id");

        assertThat(p.match("/users/")).containsEntry("id", "");
    }

    @Test
    void arityIsFixed() {
        PathPattern p = PathPattern.compile("/:a/:b");

        assertThat(p.match("/x")).isNull();
        assertThat(p.match("/x/y/z")).isNull();
        assertThat(p.match("/x/y")).containsEntry("a", "x").containsEntry("b", "y");
    }

    @Test
    void trailingSlashIsAnExtraSegment() {
        PathPattern p = PathPattern.compile("/docs");

        assertThat(p.match("/docs/")).isNull();
    }

    @Test
    void valuesAreNotDecoded() {
        assertThat(PathPattern.compile("/f/:name").match("/f/a%20b")).containsEntry("name", "a%20b");
    }

    @Test
    void segmentsAreTyped() {
        assertThat(PathPattern.compile("/a/:b").segments())
                .containsExactly(new Segment.Literal("a"), new Segment.Named("b"));
    }

    @Test
    void matchResultIsImmutable() {
        Map<String, String> params = PathPattern.compile("/:x").match("/1");

        assertThatThrownBy(() -> params.put("y", "2")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyParameterNameIsRejected() {
        assertThatThrownBy(() -> PathPattern.compile("/users/:"))
                .isInstanceOf(RouteTemplateException.class)
                .hasMessageContaining("empty parameter name");
    }

    @Test
    void duplicateParameterIsRejected() {
        assertThatThrownBy(() -> PathPattern.compile("/:id/x/:id"))
                .isInstanceOfSatisfying(RouteTemplateException.class,
                        e -> assertThat(e.getTemplate()).isEqualTo("/:id/x/:id"));
    }
}
