package com.scholary.avatar.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log job lifecycle events with structured fields that can be queried in
 * the log index.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job submitted event. */
  public void logJobSubmitted(String jobId, String character, String style, String voice) {
    try {
      MDC.put("event_type", "job_submitted");
      MDC.put("character", character);
      MDC.put("style", style);
      MDC.put("voice", voice);

      logger.info(
          "Job submitted: jobId={}, character={}, style={}, voice={}",
          jobId,
          character,
          style,
          voice);
    } finally {
      clearEventFields();
    }
  }

  /** Log poll event. */
  public void logPoll(String jobId, int pollCount, String state, long elapsedMs) {
    try {
      MDC.put("event_type", "job_poll");
      MDC.put("pollCount", String.valueOf(pollCount));
      MDC.put("state", state);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Job poll: jobId={}, poll={}, state={}, elapsed={}ms",
          jobId,
          pollCount,
          state,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a poll that failed in a way worth retrying. */
  public void logPollTransientFailure(
      String jobId, int pollCount, int transientFailures, String errorType, String message) {
    try {
      MDC.put("event_type", "job_poll_transient_failure");
      MDC.put("pollCount", String.valueOf(pollCount));
      MDC.put("transientFailures", String.valueOf(transientFailures));
      MDC.put("errorType", errorType);

      logger.warn(
          "Job poll failed, will retry: jobId={}, poll={}, failures={}, error={}, message={}",
          jobId,
          pollCount,
          transientFailures,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job terminal event. */
  public void logJobTerminal(
      String jobId, String state, int pollCount, long elapsedMs, String errorDetail) {
    try {
      MDC.put("event_type", "job_terminal");
      MDC.put("state", state);
      MDC.put("pollCount", String.valueOf(pollCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      if (errorDetail == null) {
        logger.info(
            "Job finished: jobId={}, state={}, polls={}, elapsed={}ms",
            jobId,
            state,
            pollCount,
            elapsedMs);
      } else {
        logger.warn(
            "Job finished: jobId={}, state={}, polls={}, elapsed={}ms, error={}",
            jobId,
            state,
            pollCount,
            elapsedMs,
            errorDetail);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    if (jobId != null) {
      MDC.put("jobId", jobId);
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("character");
    MDC.remove("style");
    MDC.remove("voice");
    MDC.remove("pollCount");
    MDC.remove("state");
    MDC.remove("elapsedMs");
    MDC.remove("transientFailures");
    MDC.remove("errorType");
  }
}
