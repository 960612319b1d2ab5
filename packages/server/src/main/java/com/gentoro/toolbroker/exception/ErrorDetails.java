package com.gentoro.toolbroker.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO exposing structured error information to logs and the actuator. */
public record ErrorDetails(
    String type,
    String message,
    BrokerErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
