package com.scholary.avatar.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.avatar.SynthesisRequest;
import java.util.List;
import java.util.Map;

/**
 * Body of the "create batch synthesis" call.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "inputKind": "PlainText",
 *   "synthesisConfig": {"voice": "th-TH-NiwatNeural"},
 *   "customVoices": {},
 *   "inputs": [{"content": "..."}],
 *   "avatarConfig": {"talkingAvatarCharacter": "harry", ...}
 * }
 * </pre>
 */
public record BatchSynthesisPayload(
    String inputKind,
    SynthesisConfig synthesisConfig,
    Map<String, String> customVoices,
    List<Input> inputs,
    AvatarConfig avatarConfig) {

  static final String DEFAULT_BACKGROUND_COLOR = "#FFFFFFFF";

  public static BatchSynthesisPayload from(SynthesisRequest request) {
    boolean hasBackground = request.background() != null && !request.background().isBlank();
    AvatarConfig avatarConfig =
        new AvatarConfig(
            request.avatarCharacter(),
            request.avatarStyle(),
            false,
            "mp4",
            "h264",
            "soft_embedded",
            false,
            hasBackground ? request.background() : null,
            hasBackground ? null : DEFAULT_BACKGROUND_COLOR);

    return new BatchSynthesisPayload(
        "PlainText",
        new SynthesisConfig(request.voice()),
        Map.of(),
        List.of(new Input(request.text())),
        avatarConfig);
  }

  public record SynthesisConfig(String voice) {}

  public record Input(String content) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record AvatarConfig(
      String talkingAvatarCharacter,
      String talkingAvatarStyle,
      boolean customized,
      String videoFormat,
      String videoCodec,
      String subtitleType,
      boolean useBuiltInVoice,
      String backgroundImage,
      String backgroundColor) {}
}
