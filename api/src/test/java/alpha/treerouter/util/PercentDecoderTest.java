package alpha.treerouter.util;

import org.junit.jupiter.api.Test;

import static alpha.treerouter.util.PercentDecoder.decode;
import static alpha.treerouter.util.PercentDecoder.decodeForm;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link PercentDecoder}.
 *
 * @author TreeRouter authors
 */
class PercentDecoderTest
{
    @Test
    void decode_keeps_plus() {
        assertThat(decode("a+b%20c")).isEqualTo("a+b c");
        assertThat(decode("+")).isEqualTo("+");
        assertThat(decode("++x")).isEqualTo("++x");
    }

    @Test
    void decodeForm_plus_is_space() {
        assertThat(decodeForm("a+b%20c")).isEqualTo("a b c");
    }

    @Test
    void decode_utf8() {
        assertThat(decode("%C3%A5")).isEqualTo("å");
    }

    @Test
    void malformed() {
        assertThatThrownBy(() -> decode("%zz"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
