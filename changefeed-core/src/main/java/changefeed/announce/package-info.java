/**
 * Changelist announcements with burst suppression, plus the formatting helpers they share.
 */
package changefeed.announce;
