package changefeed.spi;

/**
 * Durable local storage for the last processed change number.
 *
 * @see changefeed.tracker.FileLocalStateStore
 */
public interface LocalStateStore {

  /**
   * Loads the persisted change number.
   *
   * @return the stored value, or {@code 0} when nothing was stored yet
   */
  long load();

  /**
   * Durably stores the change number. Returns only after the value is persisted.
   */
  void save(long changeNumber);
}
