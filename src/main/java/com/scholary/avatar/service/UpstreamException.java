package com.scholary.avatar.service;

/**
 * The provider reported a failed job, refused the job, or the rendered video could not be
 * relayed to storage.
 *
 * <p>{@code jobId} is null when the job was never created.
 */
public class UpstreamException extends GenerationException {

  private final String jobId;

  public UpstreamException(String jobId, String message) {
    super(message);
    this.jobId = jobId;
  }

  public UpstreamException(String jobId, String message, Throwable cause) {
    super(message, cause);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
