package changefeed.throttle;

import changefeed.spi.WorkloadProbe;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackpressureGateTest {

  private static BackpressureGate gate(int tasks, int jobs, int processing, int locks) {
    return new BackpressureGate(WorkloadProbe.of(() -> tasks, () -> jobs, () -> processing, () -> locks));
  }

  @Test
  void idleWhenAllCountersAtLimits() {
    assertFalse(gate(0, 0, 50, 4).isBusy());
  }

  @Test
  void busyWithOutstandingTask() {
    assertTrue(gate(1, 0, 0, 0).isBusy());
  }

  @Test
  void busyWithOutstandingJob() {
    assertTrue(gate(0, 1, 0, 0).isBusy());
  }

  @Test
  void busyAboveProcessingLimit() {
    assertTrue(gate(0, 0, 51, 0).isBusy());
  }

  @Test
  void busyAboveLockLimit() {
    assertTrue(gate(0, 0, 0, 5).isBusy());
  }

  @Test
  void logStatusDoesNotSample() {
    assertDoesNotThrow(() -> gate(1, 2, 3, 4).logStatus());
  }

  @Test
  void rejectsNullProbe() {
    assertThrows(NullPointerException.class, () -> new BackpressureGate(null));
  }
}
