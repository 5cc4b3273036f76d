package com.scholary.avatar.job;

/**
 * Lifecycle state of a synthesis job.
 *
 * <p>States only move forward: SUBMITTED, then RUNNING, then one of the terminal states.
 */
public enum JobState {
  SUBMITTED,
  RUNNING,
  SUCCEEDED,
  FAILED,
  TIMED_OUT;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
  }

  /** Whether a job in this state may move to {@code next}. */
  public boolean canTransitionTo(JobState next) {
    if (isTerminal()) {
      return false;
    }
    return next.ordinal() >= ordinal() && next != SUBMITTED;
  }
}
