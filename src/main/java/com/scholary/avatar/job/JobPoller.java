package com.scholary.avatar.job;

import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.logging.StructuredLogger;
import com.scholary.avatar.provider.PollOutcome;
import com.scholary.avatar.provider.ProviderClient;
import com.scholary.avatar.provider.ProviderException;
import com.scholary.avatar.provider.ProviderRejectedException;
import com.scholary.avatar.provider.ProviderUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one synthesis job from submission to a terminal state.
 *
 * <p>The loop:
 *
 * <ol>
 *   <li>Submit. A failed submission is final: there is no job to poll.
 *   <li>Before every poll, check the budget. Once {@code now - submittedAt >= budget} the job is
 *       TIMED_OUT and the provider is not called again.
 *   <li>Poll and apply the outcome. A single poll may block for at most the budget left.
 *       Transport failures are counted and retried on the next tick; a refused query or an
 *       explicit failure ends the job.
 *   <li>Sleep one interval.
 * </ol>
 *
 * <p>Clock and sleeper are injected, so a test can run the whole budget without waiting. The
 * poller keeps no per-job state in fields and may be shared by concurrent callers.
 */
public class JobPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobPoller.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String MISSING_RESULT_URL = "Job succeeded but no result URL found";

  private final ProviderClient providerClient;
  private final PollingPolicy policy;
  private final Clock clock;
  private final Sleeper sleeper;

  public JobPoller(
      ProviderClient providerClient, PollingPolicy policy, Clock clock, Sleeper sleeper) {
    this.providerClient = providerClient;
    this.policy = policy;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public PollingPolicy getPolicy() {
    return policy;
  }

  /**
   * Submit the request and poll until the job is terminal.
   *
   * @param request what to render
   * @return the job in SUCCEEDED, FAILED or TIMED_OUT state
   */
  public SynthesisJob run(SynthesisRequest request) {
    try {
      SynthesisJob job = submit(request);
      if (job.isTerminal()) {
        return job;
      }

      pollUntilTerminal(job);
      structuredLogger.logJobTerminal(
          job.getJobId(),
          job.getState().name(),
          job.getPollCount(),
          elapsed(job).toMillis(),
          job.getErrorDetail());
      return job;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private SynthesisJob submit(SynthesisRequest request) {
    try {
      String jobId = providerClient.submit(request);
      StructuredLogger.setJobContext(jobId);
      SynthesisJob job = new SynthesisJob(jobId, clock.instant());
      structuredLogger.logJobSubmitted(
          jobId, request.avatarCharacter(), request.avatarStyle(), request.voice());
      return job;
    } catch (ProviderException e) {
      LOGGER.error("Job submission failed: {}", e.getMessage(), e);
      return SynthesisJob.failedSubmission(clock.instant(), e.kind() + ": " + e.getMessage());
    }
  }

  private void pollUntilTerminal(SynthesisJob job) {
    Instant deadline = job.getSubmittedAt().plus(policy.budget());

    while (!job.isTerminal()) {
      if (!clock.instant().isBefore(deadline)) {
        job.timeOut();
        return;
      }

      pollOnce(job, Duration.between(clock.instant(), deadline));
      if (job.isTerminal()) {
        return;
      }

      try {
        sleeper.sleep(policy.interval());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        job.fail("Polling interrupted");
        return;
      }
    }
  }

  private void pollOnce(SynthesisJob job, Duration remaining) {
    job.recordPoll();
    PollOutcome outcome;
    try {
      outcome = providerClient.poll(job.getJobId(), remaining);
    } catch (ProviderUnavailableException e) {
      job.recordTransientFailure();
      structuredLogger.logPollTransientFailure(
          job.getJobId(),
          job.getPollCount(),
          job.getTransientFailures(),
          e.kind(),
          e.getMessage());
      return;
    } catch (ProviderRejectedException e) {
      job.fail(e.kind() + ": " + e.getMessage());
      return;
    }

    structuredLogger.logPoll(
        job.getJobId(), job.getPollCount(), outcome.state().name(), elapsed(job).toMillis());
    apply(job, outcome);
  }

  private void apply(SynthesisJob job, PollOutcome outcome) {
    switch (outcome.state()) {
      case SUCCEEDED:
        if (outcome.artifactUrl() == null || outcome.artifactUrl().isBlank()) {
          job.fail(MISSING_RESULT_URL);
        } else {
          job.succeed(outcome.artifactUrl());
        }
        break;
      case FAILED:
        job.fail(
            outcome.errorDetail() == null ? "Avatar job failed" : outcome.errorDetail());
        break;
      default:
        job.markRunning();
        break;
    }
  }

  private Duration elapsed(SynthesisJob job) {
    return Duration.between(job.getSubmittedAt(), clock.instant());
  }
}
