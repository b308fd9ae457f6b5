/**
 * Per-response processing: history, token jobs, refresh fan-out and announcements.
 *
 * @see changefeed.process.ChangeProcessor
 */
package changefeed.process;
