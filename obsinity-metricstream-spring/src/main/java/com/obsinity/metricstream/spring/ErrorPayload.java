package com.obsinity.metricstream.spring;

import java.time.Instant;

/** Structured error payload returned by the transform endpoint. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
