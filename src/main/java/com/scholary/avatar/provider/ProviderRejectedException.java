package com.scholary.avatar.provider;

/** The provider answered with a client error (4xx other than 429). Retrying will not help. */
public class ProviderRejectedException extends ProviderException {

  private final int statusCode;

  public ProviderRejectedException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  @Override
  public String kind() {
    return "ProviderRejected";
  }
}
