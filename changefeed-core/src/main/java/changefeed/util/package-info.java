/**
 * Small shared helpers: thread naming, list partitioning and sleeping.
 */
package changefeed.util;
