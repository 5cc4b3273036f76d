package com.scholary.avatar.job;

import java.time.Instant;

/**
 * One provider job, from submission to a terminal state.
 *
 * <p>A job belongs to the call that created it. It is never shared between threads and is not
 * stored anywhere once that call returns.
 */
public class SynthesisJob {

  private final String jobId;
  private final Instant submittedAt;

  private JobState state;
  private String artifactUrl;
  private String errorDetail;
  private int pollCount;
  private int transientFailures;

  public SynthesisJob(String jobId, Instant submittedAt) {
    this.jobId = jobId;
    this.submittedAt = submittedAt;
    this.state = JobState.SUBMITTED;
  }

  /** A job whose submission failed: it never got an id and is FAILED from the start. */
  public static SynthesisJob failedSubmission(Instant at, String errorDetail) {
    SynthesisJob job = new SynthesisJob(null, at);
    job.fail(errorDetail);
    return job;
  }

  public String getJobId() {
    return jobId;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public JobState getState() {
    return state;
  }

  public String getArtifactUrl() {
    return artifactUrl;
  }

  public String getErrorDetail() {
    return errorDetail;
  }

  public int getPollCount() {
    return pollCount;
  }

  public int getTransientFailures() {
    return transientFailures;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  void recordPoll() {
    pollCount++;
  }

  void recordTransientFailure() {
    transientFailures++;
  }

  void markRunning() {
    transitionTo(JobState.RUNNING);
  }

  void succeed(String url) {
    transitionTo(JobState.SUCCEEDED);
    this.artifactUrl = url;
  }

  void fail(String detail) {
    transitionTo(JobState.FAILED);
    this.errorDetail = detail;
  }

  void timeOut() {
    transitionTo(JobState.TIMED_OUT);
  }

  private void transitionTo(JobState next) {
    if (state == next && !next.isTerminal()) {
      return;
    }
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Job %s cannot move from %s to %s", jobId, state, next));
    }
    state = next;
  }
}
