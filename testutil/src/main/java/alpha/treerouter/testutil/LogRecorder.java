package alpha.treerouter.testutil;

import org.assertj.core.api.AbstractThrowableAssert;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.util.Comparator.comparing;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * A utility for asserting log records.<p>
 *
 * Each observed record's values are compared with the arguments accordingly:
 *
 * <ul>
 *   <li>{@code getLevel()} must be equal to {@code level}</li>
 *   <li>{@code getMessage().}{@link String#startsWith(String) startsWith}{@code ()}
 *       must return {@code true} given {@code messageStartsWith}</li>
 *   <li>{@code getThrown()} must be an instance of {@code thr}</li>
 * </ul>
 *
 * Methods with an "assert" prefix throws an {@code AssertionError} if the
 * record can not be found.<p>
 *
 * Methods with "remove" in their name will remove and return the earliest
 * record which is a match, meaning that the matched record will not be matched
 * again. The purpose is to limit subsequent assertions to what is left
 * behind.<p>
 *
 * For example:
 * <pre>
 *     // The test provoked an expected error...
 *     recorder.assertRemove(ERROR, "Internal Server Error", IOException.class);
 *     // ...but no other warnings or records with a throwable are expected
 *     recorder.assertNoProblem();
 * </pre>
 *
 * Recording is implemented by adding a JUL handler to the logger of each
 * targeted package and lowering the logger's level to {@code ALL}. The level is
 * restored by {@link #stopRecording()}.
 *
 * @author TreeRouter authors
 */
public final class LogRecorder
{
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.<p>
     *
     * Recording should eventually be stopped using {@link #stopRecording()}.
     *
     * @param firstComponent at least one
     * @param more may be provided
     *
     * @return a new log recorder
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(RecordHandler::new)
                .toArray(RecordHandler[]::new);
        return new LogRecorder(h);
    }

    private final RecordHandler[] handlers;

    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }

    /**
     * Removes the matched record.
     *
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public LogRecorder assertRemove(System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith));
        return this;
    }

    /**
     * Removes the matched record.
     *
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * @param thr record's thrown predicate
     *
     * @return an assert object of the throwable
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertRemove(System.Logger.Level level, String messageStartsWith,
           Class<? extends Throwable> thr)
    {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        requireNonNull(thr);
        var rec = assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith) &&
                thr.isInstance(r.getThrown()));
        return assertThat(rec.getThrown());
    }

    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     *
     * @return this for chaining/fluency
     *
     * @throws AssertionError
     *             if a record has a throwable
     *             or a level greater than {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(v -> v.getLevel().intValue() > Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }

    /**
     * Returns the messages of all records with the given level, in order of
     * publication.
     *
     * @param level of records
     *
     * @return messages (never {@code null})
     */
    public List<String> messages(System.Logger.Level level) {
        var jul = toJUL(level);
        return records().stream()
                        .filter(r -> r.getLevel().equals(jul))
                        .map(LogRecord::getMessage)
                        .toList();
    }

    /**
     * Stop recording log records.
     */
    public void stopRecording() {
        Stream.of(handlers).forEach(RecordHandler::uninstall);
    }

    private List<LogRecord> records() {
        return Stream.of(handlers)
                .flatMap(h -> h.deq.stream())
                .sorted(comparing(LogRecord::getSequenceNumber))
                .toList();
    }

    private LogRecord assertRemoveIf(Predicate<LogRecord> test) {
        LogRecord match = null;
        search: for (var h : handlers) {
            var it = h.deq.iterator();
            while (it.hasNext()) {
                var r = it.next();
                if (test.test(r)) {
                    it.remove();
                    match = r;
                    break search;
                }
            }
        }
        assertNotNull(match, "No matching log record.");
        return match;
    }

    /**
     * Maps a System.Logger level to the JUL level used by the JDK's default
     * logger finder.
     *
     * @param level to map
     *
     * @return the JUL level
     */
    static Level toJUL(System.Logger.Level level) {
        return switch (requireNonNull(level)) {
            case ALL     -> Level.ALL;
            case TRACE   -> Level.FINER;
            case DEBUG   -> Level.FINE;
            case INFO    -> Level.INFO;
            case WARNING -> Level.WARNING;
            case ERROR   -> Level.SEVERE;
            case OFF     -> Level.OFF;
        };
    }

    private static final class RecordHandler extends Handler {
        // Strong reference, JUL only keeps weak references to its loggers
        private final Logger logger;
        private final Level before;
        private final Deque<LogRecord> deq;

        RecordHandler(Class<?> component) {
            logger = Logger.getLogger(component.getPackageName());
            before = logger.getLevel();
            deq    = new ConcurrentLinkedDeque<>();
            super.setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }

        void uninstall() {
            logger.removeHandler(this);
            logger.setLevel(before);
        }

        @Override
        public void publish(LogRecord record) {
            deq.add(record);
        }

        @Override
        public void flush() {
            // Empty
        }

        @Override
        public void close() {
            // Empty
        }
    }
}
