package com.scholary.avatar.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.job.JobState;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Azure batch avatar synthesis API.
 *
 * <p>The job id is chosen client-side: a job is created with {@code PUT
 * /avatar/batchsyntheses/{id}} and read back with {@code GET} on the same URL.
 *
 * <p>No retries happen here. A failed call is classified and thrown; the poller decides whether
 * it is worth trying again. The underlying {@link HttpClient} is shared by all jobs.
 */
@Component
public class AzureAvatarClient implements ProviderClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AzureAvatarClient.class);

  static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";

  private final HttpClient httpClient;
  private final ProviderProperties properties;
  private final ObjectMapper objectMapper;
  private final String baseUrl;

  public AzureAvatarClient(ProviderProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.baseUrl = stripTrailingSlash(properties.endpoint());

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized avatar provider client: endpoint={}, apiVersion={}",
        baseUrl,
        properties.apiVersion());
  }

  @Override
  public String submit(SynthesisRequest request) {
    String jobId = UUID.randomUUID().toString();

    String body;
    try {
      body = objectMapper.writeValueAsString(BatchSynthesisPayload.from(request));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise synthesis payload", e);
    }

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(jobUri(jobId))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header(SUBSCRIPTION_KEY_HEADER, properties.subscriptionKey())
            .header("Content-Type", "application/json")
            .PUT(BodyPublishers.ofString(body))
            .build();

    LOGGER.debug("Creating synthesis job: uri={}", httpRequest.uri());

    HttpResponse<String> response = send(httpRequest, "create job " + jobId);
    if (response.statusCode() >= 400) {
      throw classify(response, "Avatar job creation failed");
    }

    LOGGER.info(
        "Created synthesis job: jobId={}, character={}, style={}, voice={}",
        jobId,
        request.avatarCharacter(),
        request.avatarStyle(),
        request.voice());
    return jobId;
  }

  @Override
  public PollOutcome poll(String jobId, Duration maxWait) {
    Duration readTimeout = Duration.ofSeconds(properties.readTimeout());
    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(jobUri(jobId))
            .timeout(maxWait.compareTo(readTimeout) < 0 ? maxWait : readTimeout)
            .header(SUBSCRIPTION_KEY_HEADER, properties.subscriptionKey())
            .GET()
            .build();

    HttpResponse<String> response = send(httpRequest, "poll job " + jobId);
    if (response.statusCode() >= 400) {
      throw classify(response, "Avatar job status query failed");
    }

    BatchSynthesisStatus status;
    try {
      status = objectMapper.readValue(response.body(), BatchSynthesisStatus.class);
    } catch (JsonProcessingException e) {
      throw new ProviderUnavailableException(
          String.format("Unreadable status response for job %s", jobId), e);
    }

    JobState state = ProviderJobStatus.classify(status.status());
    LOGGER.debug("Polled job: jobId={}, status={}, state={}", jobId, status.status(), state);

    switch (state) {
      case SUCCEEDED:
        return PollOutcome.succeeded(status.resultUrl());
      case FAILED:
        return PollOutcome.failed(describeFailure(status, response.body()));
      default:
        return PollOutcome.inProgress(state);
    }
  }

  private HttpResponse<String> send(HttpRequest request, String action) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          String.format("Provider unreachable during %s: %s", action, e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderUnavailableException(
          String.format("Interrupted during %s", action), e);
    }
  }

  /** 429 and 5xx are worth waiting out, any other error status is final. */
  private ProviderException classify(HttpResponse<String> response, String what) {
    int code = response.statusCode();
    String message = String.format("%s [%d]: %s", what, code, response.body());
    if (code == 429 || code >= 500) {
      return new ProviderUnavailableException(message);
    }
    return new ProviderRejectedException(message, code);
  }

  private String describeFailure(BatchSynthesisStatus status, String rawBody) {
    BatchSynthesisStatus.Error error = status.error();
    if (error == null || error.message() == null) {
      return rawBody;
    }
    return error.code() == null ? error.message() : error.code() + ": " + error.message();
  }

  private URI jobUri(String jobId) {
    return URI.create(
        String.format(
            "%s/avatar/batchsyntheses/%s?api-version=%s",
            baseUrl, jobId, properties.apiVersion()));
  }

  private static String stripTrailingSlash(String endpoint) {
    String result = endpoint;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
