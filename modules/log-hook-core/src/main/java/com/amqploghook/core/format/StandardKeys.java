package com.amqploghook.core.format;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

final class StandardKeys {
  static final String TIME = "time";
  static final String LEVEL = "level";
  static final String MESSAGE = "msg";

  private static final Set<String> RESERVED = Set.of(TIME, LEVEL, MESSAGE);
  private static final String CLASH_PREFIX = "fields.";

  private StandardKeys() {}

  // User fields named like a standard key are moved under "fields.<key>".
  static TreeMap<String, Object> userFields(Map<String, Object> fields) {
    TreeMap<String, Object> data = new TreeMap<>();
    fields.forEach(
        (key, value) -> {
          String target = RESERVED.contains(key) ? CLASH_PREFIX + key : key;
          data.put(target, renderValue(value));
        });
    return data;
  }

  static Object renderValue(Object value) {
    if (value instanceof Throwable throwable) {
      return throwable.getMessage() == null ? throwable.toString() : throwable.getMessage();
    }
    return value;
  }
}
