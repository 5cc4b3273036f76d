package com.scholary.avatar.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.catalog.AvatarCatalog;
import com.scholary.avatar.catalog.ParameterValidator;
import com.scholary.avatar.service.AvatarGenerationService;
import com.scholary.avatar.service.GenerationResult;
import com.scholary.avatar.service.GenerationTimeoutException;
import com.scholary.avatar.service.InvalidInputException;
import com.scholary.avatar.service.UpstreamException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.beans.TypeMismatchException;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

@WebMvcTest(AvatarController.class)
@TestPropertySource(properties = "api.key=test-secret")
class AvatarControllerTest {

  @TestConfiguration
  @EnableConfigurationProperties(ApiProperties.class)
  @Import({ApiKeyGate.class, AvatarCatalog.class, ParameterValidator.class})
  static class Collaborators {}

  @Autowired MockMvc mvc;

  @MockBean AvatarGenerationService generationService;

  @Test
  void generate_success_returnsVideoUrlAndJobId() throws Exception {
    given(generationService.generate(any()))
        .willReturn(new GenerationResult("job-1", "https://storage/x.mp4"));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"สวัสดี\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.video_url").value("https://storage/x.mp4"))
        .andExpect(jsonPath("$.job_id").value("job-1"));

    verify(generationService)
        .generate(new SynthesisRequest("สวัสดี", "th-TH-NiwatNeural", "harry", "casual", null));
  }

  @Test
  void generate_keyInBody_isAccepted() throws Exception {
    given(generationService.generate(any()))
        .willReturn(new GenerationResult("job-1", "https://storage/x.mp4"));

    mvc.perform(
            post("/generate-avatar")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"key\":\"test-secret\",\"text\":\"hi\",\"voice\":\"th-TH-AcharaNeural\","
                        + "\"talkingAvatarCharacter\":\"meg\",\"talkingAvatarStyle\":\"formal\"}"))
        .andExpect(status().isOk());

    verify(generationService)
        .generate(new SynthesisRequest("hi", "th-TH-AcharaNeural", "meg", "formal", null));
  }

  @Test
  void generate_wrongKey_returns401BeforeValidation() throws Exception {
    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "nope")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("Invalid or missing API key"));

    verify(generationService, never()).generate(any());
  }

  @Test
  void generate_missingKey_returns401() throws Exception {
    mvc.perform(
            post("/generate-avatar")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hi\"}"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void generate_invalidStyle_returns400() throws Exception {
    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"text\":\"hi\",\"talkingAvatarCharacter\":\"jeff\","
                        + "\"talkingAvatarStyle\":\"casual\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.error")
                .value("Invalid style 'casual' for character 'jeff'. Valid: [business, formal]"));

    verify(generationService, never()).generate(any());
  }

  @Test
  void generate_missingText_returns400() throws Exception {
    given(generationService.generate(any()))
        .willThrow(new InvalidInputException("Missing 'text' field"));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"voice\":\"not-checked-without-text\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing 'text' field"));
  }

  @Test
  void generate_upstreamFailure_returns502() throws Exception {
    given(generationService.generate(any()))
        .willThrow(new UpstreamException("job-1", "Avatar job failed: InvalidVoice"));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hi\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("Avatar job failed: InvalidVoice"));
  }

  @Test
  void generate_timeout_returns504() throws Exception {
    given(generationService.generate(any()))
        .willThrow(new GenerationTimeoutException("job-1", Duration.ofSeconds(600)));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hi\"}"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.error").value("Avatar job job-1 did not finish within 600s"));
  }

  @Test
  void generate_unexpectedError_returns500() throws Exception {
    given(generationService.generate(any())).willThrow(new IllegalStateException("boom"));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hi\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Unexpected error: boom"));
  }

  @Test
  void generate_springStatusException_keepsItsStatus() throws Exception {
    given(generationService.generate(any()))
        .willThrow(new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "draining"));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hi\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("draining"));
  }

  @Test
  void generate_typeMismatch_returns400() throws Exception {
    given(generationService.generate(any()))
        .willThrow(new TypeMismatchException("abc", Integer.class));

    mvc.perform(
            post("/generate-avatar")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hi\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid value 'abc'"));
  }

  @Test
  void crossOriginRequest_isAllowed() throws Exception {
    mvc.perform(get("/models").header("Origin", "https://frontend.example"))
        .andExpect(status().isOk())
        .andExpect(header().string("Access-Control-Allow-Origin", "*"));
  }

  @Test
  void crossOriginPreflight_forGenerate_isAllowed() throws Exception {
    mvc.perform(
            options("/generate-avatar")
                .header("Origin", "https://frontend.example")
                .header("Access-Control-Request-Method", "POST")
                .header("Access-Control-Request-Headers", "X-API-Key, Content-Type"))
        .andExpect(status().isOk())
        .andExpect(header().string("Access-Control-Allow-Origin", "*"))
        .andExpect(header().string("Access-Control-Allow-Methods", "POST"));
  }

  @Test
  void health_models_voices() throws Exception {
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));

    mvc.perform(get("/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.avatars.harry[2]").value("youthful"))
        .andExpect(jsonPath("$.avatars.lisa.length()").value(5));

    mvc.perform(get("/voices"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.voices.male[0]").value("th-TH-NiwatNeural"));
  }
}
