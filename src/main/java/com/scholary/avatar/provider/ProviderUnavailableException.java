package com.scholary.avatar.provider;

/** The provider could not be reached, timed out, throttled us, or answered with a 5xx. */
public class ProviderUnavailableException extends ProviderException {

  public ProviderUnavailableException(String message) {
    super(message);
  }

  public ProviderUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String kind() {
    return "ProviderUnavailable";
  }
}
