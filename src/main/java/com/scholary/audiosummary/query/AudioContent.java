package com.scholary.audiosummary.query;

import java.io.InputStream;

/** An open stored audio object. The caller owns {@code stream} and must close it. */
public record AudioContent(String fileName, long contentLength, InputStream stream) {}
