/**
 * Value types flowing through the change-feed pipeline: feed responses, token and
 * product-info requests, and stored naming data.
 *
 * @see changefeed.model.FeedResponse
 * @see changefeed.model.TokenRequest
 */
package changefeed.model;
