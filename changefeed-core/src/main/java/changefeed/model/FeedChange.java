package changefeed.model;

import java.util.Objects;

/**
 * One changed item inside a {@link FeedResponse}: its identifier and the change number that
 * produced it.
 *
 * @param id           app or package identifier
 * @param kind         item kind
 * @param changeNumber change number the item last changed in
 */
public record FeedChange(int id, ItemKind kind, long changeNumber) {

  public FeedChange {
    Objects.requireNonNull(kind, "kind");
    if (changeNumber < 0) {
      throw new IllegalArgumentException("changeNumber must be >= 0");
    }
  }

  public static FeedChange app(int id, long changeNumber) {
    return new FeedChange(id, ItemKind.APP, changeNumber);
  }

  public static FeedChange pkg(int id, long changeNumber) {
    return new FeedChange(id, ItemKind.PACKAGE, changeNumber);
  }
}
