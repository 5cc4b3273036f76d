package com.scholary.avatar.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Successful response of {@code POST /generate-avatar}. */
public record GenerateAvatarResponse(
    boolean success,
    @JsonProperty("video_url") String videoUrl,
    @JsonProperty("job_id") String jobId) {

  public static GenerateAvatarResponse of(String videoUrl, String jobId) {
    return new GenerateAvatarResponse(true, videoUrl, jobId);
  }
}
