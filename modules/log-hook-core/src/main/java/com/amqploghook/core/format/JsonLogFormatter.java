package com.amqploghook.core.format;

import com.amqploghook.core.LogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Renders an entry as a single JSON object with alphabetically sorted keys.
 *
 * <p>Standard keys are {@code level}, {@code msg} and, unless disabled, {@code time}. User
 * fields that clash with a standard key are written as {@code fields.<key>}.
 */
public class JsonLogFormatter implements LogFormatter {
  private final ObjectMapper objectMapper;
  private final boolean includeTimestamp;

  public JsonLogFormatter() {
    this(new ObjectMapper(), true);
  }

  public JsonLogFormatter(ObjectMapper objectMapper, boolean includeTimestamp) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.includeTimestamp = includeTimestamp;
  }

  @Override
  public byte[] format(LogEntry entry) throws LogFormatException {
    TreeMap<String, Object> data = StandardKeys.userFields(entry.fields());
    if (includeTimestamp) {
      data.put(StandardKeys.TIME, DateTimeFormatter.ISO_INSTANT.format(entry.time()));
    }
    data.put(StandardKeys.MESSAGE, entry.message());
    data.put(StandardKeys.LEVEL, entry.level().label());
    try {
      return objectMapper.writeValueAsBytes(data);
    } catch (JsonProcessingException ex) {
      throw new LogFormatException("Failed to marshal log entry to JSON", ex);
    }
  }

  public boolean isIncludeTimestamp() {
    return includeTimestamp;
  }
}
