package com.scholary.avatar.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The parts of the "get batch synthesis" response we read.
 *
 * <p>{@code outputs.result} holds the video URL once the job succeeded, {@code properties.error}
 * describes a failed job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchSynthesisStatus(
    String id, String status, Outputs outputs, Properties properties) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Outputs(String result, String summary) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Properties(Error error) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Error(String code, String message) {}

  String resultUrl() {
    return outputs == null ? null : outputs.result();
  }

  Error error() {
    return properties == null ? null : properties.error();
  }
}
