package changefeed.task;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskRunnerTest {

    @Test
    void outstandingCountCoversRunningTask() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try (TaskRunner runner = new TaskRunner(1, 1000)) {
            assertTrue(runner.run("blocking", () -> {
                started.countDown();
                release.await();
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertEquals(1, runner.outstandingTasks());

            release.countDown();
            long deadline = System.currentTimeMillis() + 5000;
            while (runner.outstandingTasks() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, runner.outstandingTasks());
        }
    }

    @Test
    void failingTaskIsCountedAsFinished() {
        TaskRunner runner = new TaskRunner(Runnable::run);

        assertTrue(runner.run("failing", () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, runner.outstandingTasks());
    }

    @Test
    void closedRunnerDropsTasks() {
        TaskRunner runner = new TaskRunner(Runnable::run);
        runner.close();

        AtomicBoolean ran = new AtomicBoolean();
        assertFalse(runner.run("late", () -> ran.set(true)));
        assertFalse(ran.get());
    }

    @Test
    void rejectsInvalidPoolSettings() {
        assertThrows(IllegalArgumentException.class, () -> new TaskRunner(0, 100));
        assertThrows(IllegalArgumentException.class, () -> new TaskRunner(1, -1));
    }
}
