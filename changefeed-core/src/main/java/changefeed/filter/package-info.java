/**
 * Package suppression for the refresh fan-out.
 */
package changefeed.filter;
