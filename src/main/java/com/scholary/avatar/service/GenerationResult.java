package com.scholary.avatar.service;

/**
 * A finished generation.
 *
 * @param jobId the provider job id, usable to correlate with provider-side logs
 * @param videoUrl where the caller can fetch the video from
 */
public record GenerationResult(String jobId, String videoUrl) {}
