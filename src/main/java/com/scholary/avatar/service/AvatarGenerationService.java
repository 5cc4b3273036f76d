package com.scholary.avatar.service;

import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.job.JobPoller;
import com.scholary.avatar.job.SynthesisJob;
import com.scholary.avatar.logging.StructuredLogger;
import com.scholary.avatar.storage.StorageException;
import com.scholary.avatar.storage.StorageRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for generating an avatar video.
 *
 * <p>Phases:
 *
 * <ul>
 *   <li>Check the text is present. Voice and avatar values are checked before this call.
 *   <li>Run the job through the poller.
 *   <li>On success, relay the video to storage and return our URL.
 * </ul>
 *
 * <p>There is no retry here: one call is one submitted job. Whether to try again is the caller's
 * decision.
 */
public class AvatarGenerationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AvatarGenerationService.class);

  private final JobPoller jobPoller;
  private final StorageRelay storageRelay;

  public AvatarGenerationService(JobPoller jobPoller, StorageRelay storageRelay) {
    this.jobPoller = jobPoller;
    this.storageRelay = storageRelay;
  }

  /**
   * Generate a video for the request.
   *
   * @param request the synthesis request
   * @return job id and video URL
   * @throws InvalidInputException if the text is missing
   * @throws UpstreamException if the provider failed the job or the relay failed
   * @throws GenerationTimeoutException if the job outlived the polling budget
   */
  public GenerationResult generate(SynthesisRequest request) {
    if (request.text() == null || request.text().isBlank()) {
      throw new InvalidInputException("Missing 'text' field");
    }

    SynthesisJob job = jobPoller.run(request);

    switch (job.getState()) {
      case SUCCEEDED:
        return relay(job);
      case TIMED_OUT:
        throw new GenerationTimeoutException(job.getJobId(), jobPoller.getPolicy().budget());
      case FAILED:
        throw new UpstreamException(
            job.getJobId(), "Avatar job failed: " + job.getErrorDetail());
      default:
        throw new IllegalStateException(
            "Poller returned non-terminal job " + job.getJobId() + " in " + job.getState());
    }
  }

  private GenerationResult relay(SynthesisJob job) {
    StructuredLogger.setJobContext(job.getJobId());
    try {
      String videoUrl = storageRelay.upload(job.getArtifactUrl());
      LOGGER.info("Avatar video ready: jobId={}", job.getJobId());
      return new GenerationResult(job.getJobId(), videoUrl);
    } catch (StorageException e) {
      LOGGER.error("Relaying artifact failed: jobId={}", job.getJobId(), e);
      throw new UpstreamException(
          job.getJobId(), "Storing avatar video failed: " + e.getMessage(), e);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
