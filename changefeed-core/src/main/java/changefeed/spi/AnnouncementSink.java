package changefeed.spi;

/**
 * Outbound notification channel. Lines are pre-formatted and may carry inline color markers
 * from {@link changefeed.announce.Colors}; each call sends exactly one line.
 */
public interface AnnouncementSink {

  /** Sends a line to the low-volume announce channel. */
  void announce(String line);

  /** Sends a line to the high-volume main channel. */
  void main(String line);

  /**
   * Sends a high-visibility line about an allow-listed app. Defaults to {@link #main}.
   */
  default void importantApp(int appId, String line) {
    main(line);
  }

  /**
   * Sends a high-visibility line about an allow-listed package. Defaults to {@link #main}.
   */
  default void importantPackage(int packageId, String line) {
    main(line);
  }
}
