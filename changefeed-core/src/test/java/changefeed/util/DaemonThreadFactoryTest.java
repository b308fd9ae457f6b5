package changefeed.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

    @Test
    void namesThreadsSequentiallyAndMarksThemDaemon() {
        DaemonThreadFactory factory = new DaemonThreadFactory("changefeed-task-");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("changefeed-task-1", first.getName());
        assertEquals("changefeed-task-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void logsUncaughtExceptions() throws Exception {
        Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
        CountDownLatch logged = new CountDownLatch(1);
        LogRecord[] captured = new LogRecord[1];
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                captured[0] = record;
                logged.countDown();
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            Thread thread = new DaemonThreadFactory("changefeed-resync-").newThread(() -> {
                throw new IllegalStateException("boom");
            });
            thread.start();
            thread.join(5000);

            assertTrue(logged.await(5, TimeUnit.SECONDS));
            assertEquals(Level.SEVERE, captured[0].getLevel());
            assertTrue(captured[0].getMessage().contains("changefeed-resync-1"));
            assertInstanceOf(IllegalStateException.class, captured[0].getThrown());
        } finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    void rejectsInvalidPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
        assertThrows(IllegalArgumentException.class, () -> new DaemonThreadFactory(""));
    }
}
