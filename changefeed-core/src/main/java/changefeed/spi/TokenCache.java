package changefeed.spi;

import changefeed.model.ItemKind;

import java.util.List;

/**
 * Access tokens known to be required to read an item's metadata.
 *
 * @see changefeed.dispatch.InMemoryTokenCache
 */
public interface TokenCache {

  void put(ItemKind kind, int id, long token);

  /**
   * Returns the cached token, or {@code 0} when none is known.
   */
  long get(ItemKind kind, int id);

  /**
   * Returns every identifier of the given kind holding a token.
   */
  List<Integer> ids(ItemKind kind);
}
