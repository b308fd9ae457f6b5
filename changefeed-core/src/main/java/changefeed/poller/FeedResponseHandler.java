package changefeed.poller;

import changefeed.model.FeedResponse;

/**
 * Callback for responses received by the {@link ChangeFeedPoller}.
 *
 * <p>Implementations must return quickly: the poller calls them on its loop thread and only
 * resumes polling once they return. Long work belongs on a worker pool.
 *
 * @see changefeed.process.ChangeProcessor
 */
@FunctionalInterface
public interface FeedResponseHandler {

    /**
     * Handles one feed response.
     *
     * @param response the response, possibly a repeat of the current change number
     */
    void onResponse(FeedResponse response);
}
