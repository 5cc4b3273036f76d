package com.scholary.avatar.service;

/** The caller sent a request that cannot be rendered. */
public class InvalidInputException extends GenerationException {

  public InvalidInputException(String message) {
    super(message);
  }
}
