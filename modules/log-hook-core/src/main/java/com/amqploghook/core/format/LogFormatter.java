package com.amqploghook.core.format;

import com.amqploghook.core.LogEntry;

@FunctionalInterface
public interface LogFormatter {
  byte[] format(LogEntry entry) throws LogFormatException;
}
