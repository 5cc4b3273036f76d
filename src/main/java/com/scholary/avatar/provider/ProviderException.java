package com.scholary.avatar.provider;

/**
 * Exception thrown when a call to the synthesis provider fails.
 *
 * <p>Subclasses separate transport problems, which may clear up on their own, from requests the
 * provider refused.
 */
public abstract class ProviderException extends RuntimeException {

  protected ProviderException(String message) {
    super(message);
  }

  protected ProviderException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short label of the failure kind, used as a prefix in job error details. */
  public abstract String kind();
}
