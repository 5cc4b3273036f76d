package com.scholary.avatar.provider;

import com.scholary.avatar.SynthesisRequest;
import java.time.Duration;

/**
 * Interface for the batch synthesis provider.
 *
 * <p>Implementations are plain request/response: no retries, no waiting. The poller owns the
 * timing. Implementations must be safe for concurrent use by many in-flight jobs.
 */
public interface ProviderClient {

  /**
   * Create a synthesis job.
   *
   * @param request what to render
   * @return the job id to poll with
   * @throws ProviderUnavailableException if the provider cannot be reached or fails server-side
   * @throws ProviderRejectedException if the provider refuses the request
   */
  String submit(SynthesisRequest request);

  /**
   * Query the current status of a job.
   *
   * @param jobId id returned by {@link #submit}
   * @param maxWait upper bound on how long this call may block
   * @return the classified status
   * @throws ProviderUnavailableException if the provider cannot be reached or fails server-side
   * @throws ProviderRejectedException if the provider refuses the query (e.g. unknown job)
   */
  PollOutcome poll(String jobId, Duration maxWait);
}
