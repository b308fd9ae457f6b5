package changefeed.util;

/**
 * Pause abstraction so loops that wait between iterations can be driven by tests.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
