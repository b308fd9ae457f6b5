/**
 * Full resynchronization strategies.
 *
 * @see changefeed.resync.FullResyncEnumerator
 * @see changefeed.resync.FullRunMode
 */
package changefeed.resync;
