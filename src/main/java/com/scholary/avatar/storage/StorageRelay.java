package com.scholary.avatar.storage;

/**
 * Copies a rendered artifact from the provider into our own storage.
 *
 * <p>Provider result URLs are short-lived, so the caller is always handed a URL we control.
 */
public interface StorageRelay {

  /**
   * Relay the artifact at {@code sourceUrl}.
   *
   * @param sourceUrl the provider's download URL
   * @return a URL the caller can fetch the artifact from
   * @throws StorageException if downloading or uploading fails
   */
  String upload(String sourceUrl);
}
