package com.amqploghook.core.hook;

import com.amqploghook.core.LogEntry;
import com.amqploghook.core.LogLevel;
import java.util.List;

/**
 * Extension point invoked once per log event whose level is in {@link #levels()}.
 *
 * <p>{@link #fire(LogEntry)} signals failure by throwing; the caller decides what happens to
 * the error.
 */
public interface LogHook {
  List<LogLevel> levels();

  void fire(LogEntry entry);
}
