package com.scholary.avatar;

/**
 * One avatar synthesis request: the text to speak and the voice/avatar to render it with.
 *
 * <p>{@code background} is an optional image URL. When it is null the provider is asked for a
 * solid white background.
 */
public record SynthesisRequest(
    String text, String voice, String avatarCharacter, String avatarStyle, String background) {

  public SynthesisRequest(String text, String voice, String avatarCharacter, String avatarStyle) {
    this(text, voice, avatarCharacter, avatarStyle, null);
  }
}
