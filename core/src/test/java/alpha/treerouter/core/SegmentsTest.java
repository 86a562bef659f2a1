package alpha.treerouter.core;

import alpha.treerouter.route.RoutePatternInvalidException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Segments}.
 *
 * @author TreeRouter authors
 */
class SegmentsTest
{
    @Test
    void root() {
        assertThat(Segments.ofPattern("/")).isEmpty();
        assertThat(Segments.ofPath("/")).isEmpty();
    }

    @Test
    void static_and_capture() {
        assertThat(Segments.ofPattern("/a/:b/c")).containsExactly("a", ":b", "c");
    }

    @Test
    void trailing_slash_is_an_empty_segment() {
        assertThat(Segments.ofPath("/a/")).containsExactly("a", "");
        assertThat(Segments.ofPath("//")).containsExactly("", "");
    }

    @Test
    void path_not_starting_with_slash() {
        assertThat(Segments.ofPath("a/b")).isNull();
        assertThat(Segments.ofPath("")).isNull();
    }

    @Test
    void pattern_not_starting_with_slash() {
        assertThatThrownBy(() -> Segments.ofPattern("a"))
                .isExactlyInstanceOf(RoutePatternInvalidException.class)
                .hasMessage("Pattern must start with a forward slash: \"a\".");
        assertThatThrownBy(() -> Segments.ofPattern(""))
                .isExactlyInstanceOf(RoutePatternInvalidException.class);
    }

    @Test
    void capture_without_name() {
        assertThatThrownBy(() -> Segments.ofPattern("/a/:/b"))
                .isExactlyInstanceOf(RoutePatternInvalidException.class)
                .hasMessage("Capture segment has no name in \"/a/:/b\".");
    }

    @Test
    void capture_name() {
        assertThat(Segments.isCapture(":id")).isTrue();
        assertThat(Segments.isCapture("id")).isFalse();
        assertThat(Segments.isCapture("")).isFalse();
        assertThat(Segments.captureName(":id")).isEqualTo("id");
    }
}
