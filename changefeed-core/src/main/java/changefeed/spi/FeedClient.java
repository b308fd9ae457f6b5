package changefeed.spi;

import changefeed.model.AccessTokens;
import changefeed.model.FeedResponse;
import changefeed.model.ProductInfo;
import changefeed.model.ProductRequest;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Network client for the remote catalog.
 *
 * <p>Every call is asynchronous. A returned future either completes with the result, is
 * cancelled, or completes exceptionally with a {@link RemoteJobFailedException}.
 */
public interface FeedClient {

  /**
   * Requests the changes recorded after {@code changeNumber}.
   *
   * @param changeNumber          last change number already processed
   * @param sendAppChangelist     whether per-app changes should be listed
   * @param sendPackageChangelist whether per-package changes should be listed
   * @return the feed response
   */
  CompletableFuture<FeedResponse> changesSince(long changeNumber,
      boolean sendAppChangelist, boolean sendPackageChangelist);

  /**
   * Requests access tokens for the given items.
   *
   * @param appIds     apps to request tokens for, may be empty
   * @param packageIds packages to request tokens for, may be empty
   * @return the granted tokens
   */
  CompletableFuture<AccessTokens> accessTokens(Collection<Integer> appIds, Collection<Integer> packageIds);

  /**
   * Requests product info for the given items.
   *
   * @return one result per item the catalog answered for
   */
  CompletableFuture<List<ProductInfo>> productInfo(List<ProductRequest> apps, List<ProductRequest> packages);
}
