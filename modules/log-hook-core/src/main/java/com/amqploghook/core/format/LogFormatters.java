package com.amqploghook.core.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;

public final class LogFormatters {
  public static final String JSON = "json";
  public static final String TEXT = "text";

  private LogFormatters() {}

  public static LogFormatter create(String type, boolean includeTimestamp, ObjectMapper objectMapper) {
    String normalized = type == null ? JSON : type.trim().toLowerCase(Locale.ROOT);
    if (JSON.equals(normalized)) {
      return new JsonLogFormatter(
          objectMapper == null ? new ObjectMapper() : objectMapper, includeTimestamp);
    }
    if (TEXT.equals(normalized)) {
      return new TextLogFormatter(includeTimestamp);
    }
    throw new IllegalArgumentException("Unsupported log formatter type: " + type);
  }
}
