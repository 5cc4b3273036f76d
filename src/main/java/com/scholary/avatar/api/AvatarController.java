package com.scholary.avatar.api;

import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.catalog.AvatarCatalog;
import com.scholary.avatar.catalog.ParameterValidator;
import com.scholary.avatar.service.AvatarGenerationService;
import com.scholary.avatar.service.GenerationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for avatar video generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Generating a talking-avatar video (blocks until the video is ready)
 *   <li>Listing the available avatars and voices
 *   <li>Health checks
 * </ul>
 *
 * <p>Generation is synchronous: the request thread waits while the provider renders. Each request
 * only ever blocks its own thread.
 *
 * <p>All endpoints accept cross-origin calls, so browser front ends on other hosts can use them.
 */
@RestController
@CrossOrigin
@Tag(name = "Avatar", description = "Talking-avatar video generation API")
public class AvatarController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AvatarController.class);

  static final String API_KEY_HEADER = "X-API-Key";

  private final AvatarGenerationService generationService;
  private final ParameterValidator parameterValidator;
  private final ApiKeyGate apiKeyGate;
  private final AvatarCatalog catalog;

  public AvatarController(
      AvatarGenerationService generationService,
      ParameterValidator parameterValidator,
      ApiKeyGate apiKeyGate,
      AvatarCatalog catalog) {
    this.generationService = generationService;
    this.parameterValidator = parameterValidator;
    this.apiKeyGate = apiKeyGate;
    this.catalog = catalog;
  }

  /** Render a video and return a URL to it. */
  @PostMapping("/generate-avatar")
  @Operation(
      summary = "Generate avatar video",
      description =
          "Submit text to the avatar synthesis provider, wait for the video and return a "
              + "presigned URL to the stored copy")
  public ResponseEntity<GenerateAvatarResponse> generateAvatar(
      @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
      @RequestBody(required = false) GenerateAvatarRequest body) {

    GenerateAvatarRequest request =
        body != null ? body : new GenerateAvatarRequest(null, null, null, null, null, null);

    apiKeyGate.verify(apiKey, request.key());

    SynthesisRequest synthesisRequest = request.toSynthesisRequest();
    if (!synthesisRequest.text().isEmpty()) {
      parameterValidator.validate(synthesisRequest);
    }

    LOGGER.info(
        "Generate request: chars={}, voice={}, character={}, style={}",
        synthesisRequest.text().length(),
        synthesisRequest.voice(),
        synthesisRequest.avatarCharacter(),
        synthesisRequest.avatarStyle());

    GenerationResult result = generationService.generate(synthesisRequest);
    return ResponseEntity.ok(GenerateAvatarResponse.of(result.videoUrl(), result.jobId()));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  @GetMapping("/models")
  @Operation(summary = "List avatar characters and their styles")
  public Map<String, Map<String, List<String>>> models() {
    return Map.of("avatars", catalog.avatars());
  }

  @GetMapping("/voices")
  @Operation(summary = "List available voices")
  public Map<String, Map<String, List<String>>> voices() {
    return Map.of("voices", catalog.voices());
  }
}
