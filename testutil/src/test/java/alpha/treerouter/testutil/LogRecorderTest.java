package alpha.treerouter.testutil;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link LogRecorder}.
 *
 * @author TreeRouter authors
 */
class LogRecorderTest
{
    private static final System.Logger LOG
            = System.getLogger(LogRecorderTest.class.getPackageName());

    private LogRecorder testee;

    @BeforeEach
    void start() {
        testee = LogRecorder.startRecording(LogRecorderTest.class);
    }

    @AfterEach
    void stop() {
        testee.stopRecording();
    }

    @Test
    void messages_per_level_in_order() {
        LOG.log(DEBUG, "one");
        LOG.log(INFO, "two");
        LOG.log(DEBUG, () -> "three");
        assertThat(testee.messages(DEBUG)).containsExactly("one", "three");
        assertThat(testee.messages(INFO)).containsExactly("two");
        assertThat(testee.messages(ERROR)).isEmpty();
    }

    @Test
    void assertRemove_removes_the_match() {
        LOG.log(ERROR, "Failed: x", new IOException("boom"));
        testee.assertRemove(ERROR, "Failed", IOException.class)
              .hasMessage("boom");
        assertThat(testee.messages(ERROR)).isEmpty();
        testee.assertNoProblem();
    }

    @Test
    void assertNoProblem_fails_on_error() {
        LOG.log(ERROR, "Failed");
        assertThatThrownBy(testee::assertNoProblem)
                .isInstanceOf(AssertionError.class);
    }
}
