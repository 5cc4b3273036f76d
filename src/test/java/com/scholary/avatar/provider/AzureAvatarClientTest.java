package com.scholary.avatar.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.job.JobState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests AzureAvatarClient against an in-process HTTP server standing in for the provider. */
class AzureAvatarClientTest {

  private static final SynthesisRequest REQUEST =
      new SynthesisRequest("สวัสดี", "th-TH-PremwadeeNeural", "lisa", "casual-sitting");
  private static final Duration MAX_WAIT = Duration.ofSeconds(5);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<Recorded> requests = new CopyOnWriteArrayList<>();

  private HttpServer server;
  private volatile int responseStatus = 201;
  private volatile String responseBody = "{}";
  private volatile long stallMillis;

  private AzureAvatarClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/avatar/batchsyntheses", this::handle);
    server.start();

    String endpoint = "http://localhost:" + server.getAddress().getPort() + "/";
    client =
        new AzureAvatarClient(
            new ProviderProperties(endpoint, "speech-key", "2024-08-01", 5, 5), objectMapper);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void submit_putsPayloadUnderClientChosenJobId() throws IOException {
    String jobId = client.submit(REQUEST);

    assertThat(jobId).isNotBlank();
    assertThat(requests).hasSize(1);
    Recorded recorded = requests.get(0);
    assertThat(recorded.method()).isEqualTo("PUT");
    assertThat(recorded.path()).isEqualTo("/avatar/batchsyntheses/" + jobId);
    assertThat(recorded.query()).isEqualTo("api-version=2024-08-01");
    assertThat(recorded.subscriptionKey()).isEqualTo("speech-key");

    JsonNode body = objectMapper.readTree(recorded.body());
    assertThat(body.path("inputKind").asText()).isEqualTo("PlainText");
    assertThat(body.path("synthesisConfig").path("voice").asText())
        .isEqualTo("th-TH-PremwadeeNeural");
    assertThat(body.path("inputs").get(0).path("content").asText()).isEqualTo("สวัสดี");
    JsonNode avatar = body.path("avatarConfig");
    assertThat(avatar.path("talkingAvatarCharacter").asText()).isEqualTo("lisa");
    assertThat(avatar.path("talkingAvatarStyle").asText()).isEqualTo("casual-sitting");
    assertThat(avatar.path("videoFormat").asText()).isEqualTo("mp4");
    assertThat(avatar.path("backgroundColor").asText()).isEqualTo("#FFFFFFFF");
    assertThat(avatar.has("backgroundImage")).isFalse();
  }

  @Test
  void submit_withBackground_sendsImageInsteadOfColor() throws IOException {
    client.submit(
        new SynthesisRequest("hi", "th-TH-NiwatNeural", "max", "formal", "https://img/bg.png"));

    JsonNode avatar = objectMapper.readTree(requests.get(0).body()).path("avatarConfig");
    assertThat(avatar.path("backgroundImage").asText()).isEqualTo("https://img/bg.png");
    assertThat(avatar.has("backgroundColor")).isFalse();
  }

  @Test
  void submit_twice_usesDistinctJobIds() {
    assertThat(client.submit(REQUEST)).isNotEqualTo(client.submit(REQUEST));
  }

  @Test
  void submit_clientError_isRejected() {
    respondWith(400, "{\"error\":{\"code\":\"InvalidRequest\"}}");

    assertThatThrownBy(() -> client.submit(REQUEST))
        .isInstanceOf(ProviderRejectedException.class)
        .hasMessageContaining("[400]")
        .hasMessageContaining("InvalidRequest");
  }

  @Test
  void submit_serverErrorOrThrottling_isUnavailable() {
    respondWith(503, "busy");
    assertThatThrownBy(() -> client.submit(REQUEST))
        .isInstanceOf(ProviderUnavailableException.class);

    respondWith(429, "slow down");
    assertThatThrownBy(() -> client.submit(REQUEST))
        .isInstanceOf(ProviderUnavailableException.class);
  }

  @Test
  void submit_unreachable_isUnavailable() throws IOException {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    AzureAvatarClient unreachable =
        new AzureAvatarClient(
            new ProviderProperties(
                "http://localhost:" + closedPort, "speech-key", "2024-08-01", 1, 1),
            objectMapper);

    assertThatThrownBy(() -> unreachable.submit(REQUEST))
        .isInstanceOf(ProviderUnavailableException.class);
  }

  @Test
  void poll_succeeded_extractsResultUrl() {
    respondWith(
        200,
        "{\"id\":\"job-1\",\"status\":\"Succeeded\","
            + "\"outputs\":{\"result\":\"https://provider/x.mp4\",\"summary\":\"s\"},"
            + "\"createdDateTime\":\"2024-08-01T00:00:00Z\"}");

    PollOutcome outcome = client.poll("job-1", MAX_WAIT);

    assertThat(outcome.state()).isEqualTo(JobState.SUCCEEDED);
    assertThat(outcome.artifactUrl()).isEqualTo("https://provider/x.mp4");
    assertThat(requests.get(0).method()).isEqualTo("GET");
    assertThat(requests.get(0).path()).isEqualTo("/avatar/batchsyntheses/job-1");
  }

  @Test
  void poll_failed_extractsErrorDetail() {
    respondWith(
        200,
        "{\"id\":\"job-1\",\"status\":\"Failed\","
            + "\"properties\":{\"error\":{\"code\":\"InvalidVoice\",\"message\":\"Voice not found\"}}}");

    PollOutcome outcome = client.poll("job-1", MAX_WAIT);

    assertThat(outcome.state()).isEqualTo(JobState.FAILED);
    assertThat(outcome.errorDetail()).isEqualTo("InvalidVoice: Voice not found");
  }

  @Test
  void poll_failedWithoutErrorObject_usesRawBody() {
    String body = "{\"id\":\"job-1\",\"status\":\"Failed\"}";
    respondWith(200, body);

    assertThat(client.poll("job-1", MAX_WAIT).errorDetail()).isEqualTo(body);
  }

  @Test
  void poll_notStartedAndUnknown_areInProgress() {
    respondWith(200, "{\"status\":\"NotStarted\"}");
    assertThat(client.poll("job-1", MAX_WAIT).state()).isEqualTo(JobState.SUBMITTED);

    respondWith(200, "{\"status\":\"Queued\"}");
    assertThat(client.poll("job-1", MAX_WAIT).state()).isEqualTo(JobState.RUNNING);
  }

  @Test
  void poll_notFound_isRejected_andServerError_isUnavailable() {
    respondWith(404, "{}");
    assertThatThrownBy(() -> client.poll("job-1", MAX_WAIT))
        .isInstanceOf(ProviderRejectedException.class);

    respondWith(500, "oops");
    assertThatThrownBy(() -> client.poll("job-1", MAX_WAIT))
        .isInstanceOf(ProviderUnavailableException.class);
  }

  @Test
  void poll_slowProvider_givesUpAfterMaxWaitRatherThanReadTimeout() {
    respondWith(200, "{\"id\":\"job-1\",\"status\":\"Running\"}");
    stallMillis = 3000;

    long start = System.nanoTime();
    assertThatThrownBy(() -> client.poll("job-1", Duration.ofMillis(300)))
        .isInstanceOf(ProviderUnavailableException.class);
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
  }

  @Test
  void poll_garbageBody_isUnavailable() {
    respondWith(200, "<html>gateway</html>");

    assertThatThrownBy(() -> client.poll("job-1", MAX_WAIT))
        .isInstanceOf(ProviderUnavailableException.class);
  }

  private void respondWith(int status, String body) {
    this.responseStatus = status;
    this.responseBody = body;
  }

  private void handle(HttpExchange exchange) throws IOException {
    String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    requests.add(
        new Recorded(
            exchange.getRequestMethod(),
            exchange.getRequestURI().getPath(),
            exchange.getRequestURI().getQuery(),
            exchange.getRequestHeaders().getFirst(AzureAvatarClient.SUBSCRIPTION_KEY_HEADER),
            body));

    if (stallMillis > 0) {
      try {
        Thread.sleep(stallMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(responseStatus, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private record Recorded(
      String method, String path, String query, String subscriptionKey, String body) {}
}
