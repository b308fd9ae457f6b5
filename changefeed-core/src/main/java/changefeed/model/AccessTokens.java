package changefeed.model;

import java.util.Map;
import java.util.Objects;

/**
 * Tokens granted by the remote catalog, keyed by identifier. Identifiers that were requested
 * but are absent here did not need (or were denied) a token.
 */
public record AccessTokens(Map<Integer, Long> appTokens, Map<Integer, Long> packageTokens) {

  public AccessTokens {
    appTokens = Map.copyOf(Objects.requireNonNull(appTokens, "appTokens"));
    packageTokens = Map.copyOf(Objects.requireNonNull(packageTokens, "packageTokens"));
  }

  public static AccessTokens none() {
    return new AccessTokens(Map.of(), Map.of());
  }

  public Map<Integer, Long> tokens(ItemKind kind) {
    return kind == ItemKind.APP ? appTokens : packageTokens;
  }
}
