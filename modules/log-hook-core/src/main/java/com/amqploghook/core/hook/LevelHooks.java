package com.amqploghook.core.hook;

import com.amqploghook.core.LogEntry;
import com.amqploghook.core.LogLevel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

public class LevelHooks {
  private final Map<LogLevel, CopyOnWriteArrayList<LogHook>> hooksByLevel =
      new EnumMap<>(LogLevel.class);

  public LevelHooks() {
    for (LogLevel level : LogLevel.all()) {
      hooksByLevel.put(level, new CopyOnWriteArrayList<>());
    }
  }

  public LevelHooks add(LogHook hook) {
    Objects.requireNonNull(hook, "hook must not be null");
    List<LogLevel> levels = hook.levels();
    if (levels == null) {
      return this;
    }
    for (LogLevel level : levels) {
      hooksByLevel.get(level).add(hook);
    }
    return this;
  }

  public List<LogHook> hooksFor(LogLevel level) {
    return List.copyOf(hooksByLevel.get(Objects.requireNonNull(level, "level must not be null")));
  }

  // Stops at the first failing hook; the remaining hooks for the level are not invoked.
  public void fire(LogLevel level, LogEntry entry) {
    for (LogHook hook : hooksByLevel.get(Objects.requireNonNull(level, "level must not be null"))) {
      hook.fire(entry);
    }
  }

  public boolean isEmpty() {
    return hooksByLevel.values().stream().allMatch(List::isEmpty);
  }
}
