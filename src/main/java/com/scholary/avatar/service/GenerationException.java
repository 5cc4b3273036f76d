package com.scholary.avatar.service;

/**
 * Base class for the failures a generation call surfaces to its caller.
 *
 * <p>Each subclass maps to one distinct response at the HTTP boundary.
 */
public abstract class GenerationException extends RuntimeException {

  protected GenerationException(String message) {
    super(message);
  }

  protected GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
