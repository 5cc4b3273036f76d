package com.scholary.avatar.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * The avatars and voices the provider can render.
 *
 * <p>Fixed lists; the provider offers no discovery endpoint for them. Iteration order is the order
 * shown to clients.
 */
@Component
public class AvatarCatalog {

  private static final Map<String, List<String>> AVATARS = new LinkedHashMap<>();
  private static final Map<String, List<String>> VOICES = new LinkedHashMap<>();

  static {
    AVATARS.put("harry", List.of("business", "casual", "youthful"));
    AVATARS.put("jeff", List.of("business", "formal"));
    AVATARS.put(
        "lisa",
        List.of(
            "casual-sitting",
            "graceful-sitting",
            "graceful-standing",
            "technical-sitting",
            "technical-standing"));
    AVATARS.put("lori", List.of("casual", "graceful", "formal"));
    AVATARS.put("max", List.of("business", "casual", "formal"));
    AVATARS.put("meg", List.of("formal", "casual", "business"));

    VOICES.put("female", List.of("th-TH-PremwadeeNeural", "th-TH-AcharaNeural"));
    VOICES.put("male", List.of("th-TH-NiwatNeural"));
  }

  /** Character name to its styles. */
  public Map<String, List<String>> avatars() {
    return Collections.unmodifiableMap(AVATARS);
  }

  /** Voice gender to voice names. */
  public Map<String, List<String>> voices() {
    return Collections.unmodifiableMap(VOICES);
  }

  public boolean isKnownVoice(String voice) {
    return VOICES.values().stream().anyMatch(names -> names.contains(voice));
  }

  public boolean isKnownCharacter(String character) {
    return AVATARS.containsKey(character);
  }

  public List<String> stylesOf(String character) {
    return AVATARS.getOrDefault(character, List.of());
  }
}
