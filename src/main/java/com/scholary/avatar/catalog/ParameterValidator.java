package com.scholary.avatar.catalog;

import com.scholary.avatar.SynthesisRequest;
import com.scholary.avatar.service.InvalidInputException;
import org.springframework.stereotype.Component;

/** Checks voice, character and style against the {@link AvatarCatalog}. */
@Component
public class ParameterValidator {

  private final AvatarCatalog catalog;

  public ParameterValidator(AvatarCatalog catalog) {
    this.catalog = catalog;
  }

  /**
   * Validate the request's rendering parameters.
   *
   * @throws InvalidInputException naming the first offending value
   */
  public void validate(SynthesisRequest request) {
    String voice = request.voice();
    String character = request.avatarCharacter();
    String style = request.avatarStyle();

    if (!catalog.isKnownVoice(voice)) {
      throw new InvalidInputException(
          String.format("Invalid voice '%s'. See GET /voices for options.", voice));
    }
    if (!catalog.isKnownCharacter(character)) {
      throw new InvalidInputException(
          String.format("Invalid character '%s'. See GET /models for options.", character));
    }
    if (!catalog.stylesOf(character).contains(style)) {
      throw new InvalidInputException(
          String.format(
              "Invalid style '%s' for character '%s'. Valid: %s",
              style, character, catalog.stylesOf(character)));
    }
  }
}
