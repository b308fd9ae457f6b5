package changefeed.dispatch;

import changefeed.model.ItemKind;
import changefeed.spi.TokenCache;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based {@link TokenCache}. Contents are lost on restart.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryTokenCache implements TokenCache {
  private final Map<Integer, Long> appTokens = new ConcurrentHashMap<>();
  private final Map<Integer, Long> packageTokens = new ConcurrentHashMap<>();

  @Override
  public void put(ItemKind kind, int id, long token) {
    tokens(kind).put(id, token);
  }

  @Override
  public long get(ItemKind kind, int id) {
    return tokens(kind).getOrDefault(id, 0L);
  }

  @Override
  public List<Integer> ids(ItemKind kind) {
    return new ArrayList<>(tokens(kind).keySet());
  }

  private Map<Integer, Long> tokens(ItemKind kind) {
    Objects.requireNonNull(kind, "kind");
    return kind == ItemKind.APP ? appTokens : packageTokens;
  }
}
