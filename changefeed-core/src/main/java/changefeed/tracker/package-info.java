/**
 * Feed position tracking: the in-memory change number and its persisted local copy.
 *
 * @see changefeed.tracker.ChangeNumberTracker
 * @see changefeed.tracker.FileLocalStateStore
 */
package changefeed.tracker;
