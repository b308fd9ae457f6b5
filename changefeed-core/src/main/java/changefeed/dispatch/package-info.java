/**
 * Token-acquisition job submission.
 *
 * <p>{@link changefeed.dispatch.BatchDispatcher} chunks identifier lists and, on the
 * throttled path, waits on the {@link changefeed.throttle.BackpressureGate} between chunks.
 * {@link changefeed.dispatch.TokenJobQueue} is the default job executor.
 *
 * @see changefeed.dispatch.BatchDispatcher
 * @see changefeed.dispatch.TokenJobQueue
 */
package changefeed.dispatch;
