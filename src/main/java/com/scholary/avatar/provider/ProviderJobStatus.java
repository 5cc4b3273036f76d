package com.scholary.avatar.provider;

import com.scholary.avatar.job.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The provider's status vocabulary for batch synthesis jobs.
 *
 * <p>Unknown or missing values classify as {@link JobState#RUNNING}: polling on is cheap, while
 * abandoning a job that is really still rendering wastes the provider's work.
 */
public enum ProviderJobStatus {
  NOT_STARTED("NotStarted", JobState.SUBMITTED),
  RUNNING("Running", JobState.RUNNING),
  SUCCEEDED("Succeeded", JobState.SUCCEEDED),
  FAILED("Failed", JobState.FAILED);

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderJobStatus.class);

  private final String wireValue;
  private final JobState jobState;

  ProviderJobStatus(String wireValue, JobState jobState) {
    this.wireValue = wireValue;
    this.jobState = jobState;
  }

  public String wireValue() {
    return wireValue;
  }

  public JobState jobState() {
    return jobState;
  }

  /**
   * Classify a raw status string.
   *
   * @param wireValue the status exactly as the provider sent it, may be null
   * @return the matching job state, RUNNING when the value is not recognised
   */
  public static JobState classify(String wireValue) {
    for (ProviderJobStatus status : values()) {
      if (status.wireValue.equals(wireValue)) {
        return status.jobState;
      }
    }
    LOGGER.warn("Unrecognised provider status '{}', treating as Running", wireValue);
    return JobState.RUNNING;
  }
}
