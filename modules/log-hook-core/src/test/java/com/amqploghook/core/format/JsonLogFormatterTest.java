package com.amqploghook.core.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amqploghook.core.LogEntry;
import com.amqploghook.core.LogLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLogFormatterTest {
  private static final Instant TIME = Instant.parse("2026-02-24T12:00:00Z");

  @Test
  void shouldRenderLevelAndMessageOnlyWhenTimestampDisabled() throws Exception {
    JsonLogFormatter formatter = new JsonLogFormatter(new ObjectMapper(), false);
    LogEntry entry = new LogEntry(LogLevel.ERROR, "disk full", Map.of(), TIME, formatter);

    assertEquals(
        "{\"level\":\"error\",\"msg\":\"disk full\"}",
        new String(formatter.format(entry), StandardCharsets.UTF_8));
  }

  @Test
  void shouldSortKeysAndPrefixClashingFields() throws Exception {
    JsonLogFormatter formatter = new JsonLogFormatter();
    LogEntry entry =
        new LogEntry(LogLevel.INFO, "hi", Map.of("b", 1, "a", "x", "msg", "clash"), TIME, formatter);

    assertEquals(
        "{\"a\":\"x\",\"b\":1,\"fields.msg\":\"clash\",\"level\":\"info\",\"msg\":\"hi\","
            + "\"time\":\"2026-02-24T12:00:00Z\"}",
        new String(formatter.format(entry), StandardCharsets.UTF_8));
  }

  @Test
  void shouldRenderThrowableFieldsAsTheirMessage() throws Exception {
    JsonLogFormatter formatter = new JsonLogFormatter(new ObjectMapper(), false);
    LogEntry entry =
        new LogEntry(
            LogLevel.WARN,
            "write failed",
            Map.of("error", new IllegalStateException("no space left")),
            TIME,
            formatter);

    assertEquals(
        "{\"error\":\"no space left\",\"level\":\"warning\",\"msg\":\"write failed\"}",
        new String(formatter.format(entry), StandardCharsets.UTF_8));
  }

  @Test
  void shouldWrapSerializationFailures() {
    JsonLogFormatter formatter = new JsonLogFormatter(new ObjectMapper(), false);
    LogEntry entry =
        new LogEntry(LogLevel.INFO, "opaque", Map.of("value", new Object()), TIME, formatter);

    LogFormatException ex = assertThrows(LogFormatException.class, () -> formatter.format(entry));
    assertEquals("Failed to marshal log entry to JSON", ex.getMessage());
  }
}
