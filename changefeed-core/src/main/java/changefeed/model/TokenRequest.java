package changefeed.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One token-acquisition job: an ordered chunk of identifiers of a single kind.
 */
public record TokenRequest(ItemKind kind, List<Integer> ids) {

  public TokenRequest {
    Objects.requireNonNull(kind, "kind");
    ids = List.copyOf(Objects.requireNonNull(ids, "ids"));
  }

  public static TokenRequest of(ItemKind kind, Collection<Integer> ids) {
    return new TokenRequest(kind, List.copyOf(ids));
  }

  public List<Integer> appIds() {
    return kind == ItemKind.APP ? ids : List.of();
  }

  public List<Integer> packageIds() {
    return kind == ItemKind.PACKAGE ? ids : List.of();
  }

  public int size() {
    return ids.size();
  }
}
