package com.scholary.avatar.storage;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays provider artifacts into our object store.
 *
 * <p>The video is streamed to a temp file first, because the upload needs an exact content length
 * and the provider does not always send one. The temp file is deleted whatever the outcome. The
 * returned URL is presigned, so the bucket itself can stay private.
 *
 * <p>The download timeout bounds the whole transfer, body included, not just the wait for the
 * response headers.
 */
public class ObjectStoreStorageRelay implements StorageRelay {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreStorageRelay.class);

  static final String VIDEO_CONTENT_TYPE = "video/mp4";

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;
  private final HttpClient httpClient;
  private final Path tempDir;
  private final Duration downloadTimeout;

  public ObjectStoreStorageRelay(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      Path tempDir,
      Duration downloadTimeout) {
    this(
        objectStoreClient,
        properties,
        tempDir,
        downloadTimeout,
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(30))
            .build());
  }

  ObjectStoreStorageRelay(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      Path tempDir,
      Duration downloadTimeout,
      HttpClient httpClient) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
    this.tempDir = tempDir;
    this.downloadTimeout = downloadTimeout;
    this.httpClient = httpClient;

    try {
      Files.createDirectories(tempDir);
    } catch (IOException e) {
      throw new StorageException("Failed to create temp directory: " + tempDir, e);
    }
  }

  @Override
  public String upload(String sourceUrl) {
    String key = properties.keyPrefix() + "/" + UUID.randomUUID() + ".mp4";
    Path localFile = download(sourceUrl);

    try (InputStream data = Files.newInputStream(localFile)) {
      long size = Files.size(localFile);
      LOGGER.info("Relaying artifact: source={}, key={}, size={} bytes", sourceUrl, key, size);
      objectStoreClient.putObject(properties.bucket(), key, data, size, VIDEO_CONTENT_TYPE);
    } catch (IOException e) {
      throw new StorageException("Failed to read downloaded artifact: " + localFile, e);
    } finally {
      deleteQuietly(localFile);
    }

    URL url = objectStoreClient.presignGet(properties.bucket(), key, properties.urlTtl());
    return url.toString();
  }

  private Path download(String sourceUrl) {
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(URI.create(sourceUrl))
              .timeout(downloadTimeout)
              .GET()
              .build();
    } catch (IllegalArgumentException e) {
      throw new StorageException("Invalid artifact URL: " + sourceUrl, e);
    }

    Path target;
    try {
      target = Files.createTempFile(tempDir, "avatar_", ".mp4");
    } catch (IOException e) {
      throw new StorageException("Failed to create temp file in " + tempDir, e);
    }

    CompletableFuture<HttpResponse<Path>> transfer =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(target));
    try {
      HttpResponse<Path> response =
          transfer.get(downloadTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (response.statusCode() != 200) {
        throw new StorageException(
            String.format(
                "Artifact download failed [%d]: %s", response.statusCode(), sourceUrl));
      }
      return target;

    } catch (TimeoutException e) {
      transfer.cancel(true);
      deleteQuietly(target);
      throw new StorageException(
          String.format(
              "Artifact download timed out after %ds: %s",
              downloadTimeout.toSeconds(), sourceUrl),
          e);
    } catch (ExecutionException e) {
      deleteQuietly(target);
      throw new StorageException("Artifact download failed: " + sourceUrl, e.getCause());
    } catch (InterruptedException e) {
      transfer.cancel(true);
      Thread.currentThread().interrupt();
      deleteQuietly(target);
      throw new StorageException("Artifact download interrupted: " + sourceUrl, e);
    } catch (StorageException e) {
      deleteQuietly(target);
      throw e;
    }
  }

  private void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", file, e.getMessage());
    }
  }
}
