package com.scholary.avatar.provider;

import com.scholary.avatar.job.JobState;

/**
 * Result of a single status query against the provider.
 *
 * <p>{@code artifactUrl} is only meaningful for SUCCEEDED, {@code errorDetail} only for FAILED.
 */
public record PollOutcome(JobState state, String artifactUrl, String errorDetail) {

  public static PollOutcome inProgress(JobState state) {
    return new PollOutcome(state, null, null);
  }

  public static PollOutcome succeeded(String artifactUrl) {
    return new PollOutcome(JobState.SUCCEEDED, artifactUrl, null);
  }

  public static PollOutcome failed(String errorDetail) {
    return new PollOutcome(JobState.FAILED, null, errorDetail);
  }
}
