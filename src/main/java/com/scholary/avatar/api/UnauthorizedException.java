package com.scholary.avatar.api;

/** The caller did not present the configured API key. */
public class UnauthorizedException extends RuntimeException {

  public UnauthorizedException(String message) {
    super(message);
  }
}
