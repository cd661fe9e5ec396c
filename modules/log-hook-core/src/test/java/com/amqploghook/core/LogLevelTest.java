package com.amqploghook.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogLevelTest {
  @Test
  void shouldListSixLevelsFromMostToLeastSevere() {
    assertEquals(
        List.of(
            LogLevel.PANIC,
            LogLevel.FATAL,
            LogLevel.ERROR,
            LogLevel.WARN,
            LogLevel.INFO,
            LogLevel.DEBUG),
        LogLevel.all());
  }

  @Test
  void shouldParseLabelsCaseInsensitively() {
    assertEquals(LogLevel.ERROR, LogLevel.parse("ERROR"));
    assertEquals(LogLevel.WARN, LogLevel.parse("warning"));
    assertEquals(LogLevel.WARN, LogLevel.parse(" warn "));
    assertEquals(LogLevel.DEBUG, LogLevel.parse("Debug"));
  }

  @Test
  void shouldRejectUnknownLevels() {
    assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("trace"));
    assertThrows(IllegalArgumentException.class, () -> LogLevel.parse(" "));
  }

  @Test
  void shouldRenderWarnAsWarning() {
    assertEquals("warning", LogLevel.WARN.label());
    assertEquals("panic", LogLevel.PANIC.toString());
  }
}
