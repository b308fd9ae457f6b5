package changefeed.spi;

import changefeed.model.TokenRequest;

/**
 * Executor for token-acquisition jobs.
 *
 * @see changefeed.dispatch.TokenJobQueue
 */
public interface JobQueue {

  /**
   * Submits one job. Must not block on the remote call and must not throw when the remote
   * call fails; a failed job is logged and released.
   *
   * @param request the identifiers to acquire tokens for, used as the job's tag
   */
  void submit(TokenRequest request);

  /**
   * Returns the number of submitted jobs that have not completed yet.
   */
  int outstandingJobs();
}
