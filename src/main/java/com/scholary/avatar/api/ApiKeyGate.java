package com.scholary.avatar.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.stereotype.Component;

/**
 * Checks the caller's API key.
 *
 * <p>The comparison runs in constant time so the key cannot be guessed byte by byte from response
 * timings.
 */
@Component
public class ApiKeyGate {

  private final byte[] expectedKey;

  public ApiKeyGate(ApiProperties properties) {
    this.expectedKey = properties.key().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Verify the presented key.
   *
   * @param headerKey value of the X-API-Key header, may be null
   * @param bodyKey value of the body's "key" field, used when the header is absent
   * @throws UnauthorizedException if neither matches the configured key
   */
  public void verify(String headerKey, String bodyKey) {
    String provided = headerKey != null && !headerKey.isEmpty() ? headerKey : bodyKey;
    if (provided == null
        || !MessageDigest.isEqual(expectedKey, provided.getBytes(StandardCharsets.UTF_8))) {
      throw new UnauthorizedException("Invalid or missing API key");
    }
  }
}
