/**
 * Worker pool for the independent flows launched per feed response.
 *
 * @see changefeed.task.TaskRunner
 */
package changefeed.task;
