package changefeed.dispatch;

import changefeed.model.AccessTokens;
import changefeed.model.ItemKind;
import changefeed.model.ProductInfo;
import changefeed.model.ProductLookup;
import changefeed.model.ProductRequest;
import changefeed.model.TokenRequest;
import changefeed.spi.FeedClient;
import changefeed.spi.JobQueue;
import changefeed.spi.ProductInfoListener;
import changefeed.spi.TokenCache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link JobQueue}: each job asks the feed client for access tokens, caches the granted
 * tokens, then requests product info for every id of the job and hands the results to a
 * {@link ProductInfoListener}.
 *
 * <p>A job counts as outstanding from submission until its product info arrived (or either
 * request failed). Items count as processing while their product-info request is in flight.
 */
public final class TokenJobQueue implements JobQueue {
  private static final Logger logger = Logger.getLogger(TokenJobQueue.class.getName());

  private final FeedClient feedClient;
  private final TokenCache tokenCache;
  private final ProductInfoListener listener;
  private final AtomicInteger outstandingJobs = new AtomicInteger();
  private final AtomicInteger processing = new AtomicInteger();

  public TokenJobQueue(FeedClient feedClient, TokenCache tokenCache, ProductInfoListener listener) {
    this.feedClient = Objects.requireNonNull(feedClient, "feedClient");
    this.tokenCache = Objects.requireNonNull(tokenCache, "tokenCache");
    this.listener = listener != null ? listener : ProductInfoListener.NONE;
  }

  @Override
  public void submit(TokenRequest request) {
    Objects.requireNonNull(request, "request");
    outstandingJobs.incrementAndGet();
    CompletableFuture<AccessTokens> tokens;
    try {
      tokens = feedClient.accessTokens(request.appIds(), request.packageIds());
    } catch (RuntimeException e) {
      outstandingJobs.decrementAndGet();
      logger.log(Level.SEVERE, "Token job submission failed for " + request.size() + " "
          + request.kind() + " ids", e);
      return;
    }
    tokens.thenCompose(granted -> requestProductInfo(request, granted))
        .whenComplete((infos, error) -> {
          try {
            if (error != null) {
              logger.log(Level.SEVERE, "Token job failed for " + request.size() + " "
                  + request.kind() + " ids", unwrap(error));
            } else {
              deliver(infos);
            }
          } finally {
            outstandingJobs.decrementAndGet();
          }
        });
  }

  private CompletableFuture<List<ProductInfo>> requestProductInfo(TokenRequest request, AccessTokens granted) {
    ItemKind kind = request.kind();
    Map<Integer, Long> tokens = granted.tokens(kind);
    List<ProductRequest> requests = new ArrayList<>(request.size());
    for (Integer id : request.ids()) {
      Long token = tokens.get(id);
      if (token != null) {
        tokenCache.put(kind, id, token);
        requests.add(new ProductRequest(id, kind, token));
      } else {
        requests.add(new ProductRequest(id, kind, tokenCache.get(kind, id)));
      }
    }
    int count = requests.size();
    processing.addAndGet(count);
    CompletableFuture<List<ProductInfo>> info;
    try {
      info = kind == ItemKind.APP
          ? feedClient.productInfo(requests, List.of())
          : feedClient.productInfo(List.of(), requests);
    } catch (RuntimeException e) {
      processing.addAndGet(-count);
      throw e;
    }
    return info.whenComplete((ignored, error) -> processing.addAndGet(-count));
  }

  /**
   * Looks up a single item: requests its access token, then its product info, waiting at most
   * {@code timeout} for each. A granted token is cached. Failures and timeouts are logged and
   * reported as {@link ProductLookup.Status#FAILED}.
   *
   * <p>Lookups are not counted as outstanding jobs.
   */
  public ProductLookup lookup(ItemKind kind, int id, Duration timeout) throws InterruptedException {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(timeout, "timeout");
    List<Integer> ids = List.of(id);
    try {
      AccessTokens granted = await(kind == ItemKind.APP
          ? feedClient.accessTokens(ids, List.of())
          : feedClient.accessTokens(List.of(), ids), timeout);
      Long token = granted.tokens(kind).get(id);
      if (token != null) {
        tokenCache.put(kind, id, token);
      }
      List<ProductRequest> requests = List.of(
          new ProductRequest(id, kind, token != null ? token : tokenCache.get(kind, id)));
      List<ProductInfo> infos = await(kind == ItemKind.APP
          ? feedClient.productInfo(requests, List.of())
          : feedClient.productInfo(List.of(), requests), timeout);
      for (ProductInfo info : infos) {
        if (info.id() == id && info.kind() == kind) {
          return ProductLookup.of(info);
        }
      }
      return ProductLookup.unknown(kind, id);
    } catch (ExecutionException e) {
      logger.log(Level.WARNING, "Lookup of " + kind + " " + id + " failed", e.getCause());
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Lookup of {0} {1} timed out after {2}",
          new Object[]{kind, String.valueOf(id), timeout});
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Lookup of " + kind + " " + id + " failed", e);
    }
    return ProductLookup.failed(kind, id);
  }

  private static <T> T await(CompletableFuture<T> future, Duration timeout)
      throws InterruptedException, ExecutionException, TimeoutException {
    return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void deliver(List<ProductInfo> infos) {
    for (ProductInfo info : infos) {
      if (info.missingToken()) {
        logger.log(Level.FINE, "Product info for {0} {1} withheld: missing token",
            new Object[]{info.kind(), String.valueOf(info.id())});
      }
      try {
        listener.onProductInfo(info);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Product info listener failed for " + info.kind() + " " + info.id(), e);
      }
    }
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
  }

  @Override
  public int outstandingJobs() {
    return outstandingJobs.get();
  }

  /**
   * Returns the number of items whose product-info request is in flight.
   */
  public int processingProductInfo() {
    return processing.get();
  }
}
