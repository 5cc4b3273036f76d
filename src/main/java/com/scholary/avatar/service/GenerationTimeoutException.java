package com.scholary.avatar.service;

import java.time.Duration;

/** The job did not reach a terminal state within the polling budget. */
public class GenerationTimeoutException extends GenerationException {

  private final String jobId;

  public GenerationTimeoutException(String jobId, Duration budget) {
    super(String.format("Avatar job %s did not finish within %ds", jobId, budget.toSeconds()));
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
