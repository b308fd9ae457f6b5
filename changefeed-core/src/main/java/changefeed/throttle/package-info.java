/**
 * Load sampling used to throttle batch submission.
 */
package changefeed.throttle;
