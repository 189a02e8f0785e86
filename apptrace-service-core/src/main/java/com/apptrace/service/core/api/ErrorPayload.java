package com.apptrace.service.core.api;

import java.time.Instant;

/** JSON error body shared by the query and export endpoints. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
