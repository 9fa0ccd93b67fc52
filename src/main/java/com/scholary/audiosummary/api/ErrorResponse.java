package com.scholary.audiosummary.api;

import com.scholary.audiosummary.error.ErrorCode;

/** Error body returned for every failed request. */
public record ErrorResponse(ErrorCode code, String message) {}
