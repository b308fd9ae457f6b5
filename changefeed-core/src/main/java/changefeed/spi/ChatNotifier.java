package changefeed.spi;

/**
 * Optional external chat room notified about allow-listed app updates.
 */
@FunctionalInterface
public interface ChatNotifier {

  ChatNotifier NONE = message -> {
  };

  void send(String message);
}
