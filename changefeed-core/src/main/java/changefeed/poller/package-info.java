/**
 * Change-feed polling loop with generation-based cooperative cancellation.
 *
 * @see changefeed.poller.ChangeFeedPoller
 * @see changefeed.poller.FeedResponseHandler
 */
package changefeed.poller;
