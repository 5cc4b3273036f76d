package com.scholary.avatar.storage;

/**
 * Exception thrown when relaying an artifact to storage fails.
 *
 * <p>This covers both fetching the artifact from the provider and writing it to the bucket.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
