package com.amqploghook.core.format;

import com.amqploghook.core.LogEntry;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/** Renders an entry as space separated {@code key=value} pairs. */
public class TextLogFormatter implements LogFormatter {
  private final boolean includeTimestamp;

  public TextLogFormatter() {
    this(true);
  }

  public TextLogFormatter(boolean includeTimestamp) {
    this.includeTimestamp = includeTimestamp;
  }

  @Override
  public byte[] format(LogEntry entry) {
    StringBuilder line = new StringBuilder();
    if (includeTimestamp) {
      append(line, StandardKeys.TIME, DateTimeFormatter.ISO_INSTANT.format(entry.time()));
    }
    append(line, StandardKeys.LEVEL, entry.level().label());
    append(line, StandardKeys.MESSAGE, entry.message());
    TreeMap<String, Object> fields = StandardKeys.userFields(entry.fields());
    for (Map.Entry<String, Object> field : fields.entrySet()) {
      append(line, field.getKey(), field.getValue());
    }
    return line.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static void append(StringBuilder line, String key, Object value) {
    if (line.length() > 0) {
      line.append(' ');
    }
    line.append(key).append('=').append(quoteIfNeeded(String.valueOf(value)));
  }

  private static String quoteIfNeeded(String value) {
    if (value.isEmpty()) {
      return "\"\"";
    }
    boolean needsQuoting = false;
    for (int i = 0; i < value.length(); i++) {
      char ch = value.charAt(i);
      if (Character.isWhitespace(ch) || ch == '=' || ch == '"') {
        needsQuoting = true;
        break;
      }
    }
    if (!needsQuoting) {
      return value;
    }
    StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char ch = value.charAt(i);
      switch (ch) {
        case '"' -> quoted.append("\\\"");
        case '\\' -> quoted.append("\\\\");
        case '\n' -> quoted.append("\\n");
        case '\r' -> quoted.append("\\r");
        case '\t' -> quoted.append("\\t");
        default -> quoted.append(ch);
      }
    }
    return quoted.append('"').toString();
  }
}
