package com.scholary.avatar.api;

import com.scholary.avatar.SynthesisRequest;

/**
 * Body of {@code POST /generate-avatar}.
 *
 * <p>Everything except {@code text} is optional. {@code key} is an alternative to the
 * {@code X-API-Key} header for clients that cannot set headers.
 */
public record GenerateAvatarRequest(
    String text,
    String voice,
    String talkingAvatarCharacter,
    String talkingAvatarStyle,
    String background,
    String key) {

  static final String DEFAULT_VOICE = "th-TH-NiwatNeural";
  static final String DEFAULT_CHARACTER = "harry";
  static final String DEFAULT_STYLE = "casual";

  // Provide defaults
  public GenerateAvatarRequest {
    text = text == null ? "" : text.strip();
    if (voice == null) {
      voice = DEFAULT_VOICE;
    }
    if (talkingAvatarCharacter == null) {
      talkingAvatarCharacter = DEFAULT_CHARACTER;
    }
    if (talkingAvatarStyle == null) {
      talkingAvatarStyle = DEFAULT_STYLE;
    }
  }

  public SynthesisRequest toSynthesisRequest() {
    return new SynthesisRequest(
        text, voice, talkingAvatarCharacter, talkingAvatarStyle, background);
  }
}
