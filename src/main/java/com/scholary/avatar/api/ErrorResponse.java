package com.scholary.avatar.api;

/** Body of every non-2xx response. */
public record ErrorResponse(String error) {}
