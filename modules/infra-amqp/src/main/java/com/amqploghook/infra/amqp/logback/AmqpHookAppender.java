package com.amqploghook.infra.amqp.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import com.amqploghook.core.LogEntry;
import com.amqploghook.core.LogLevel;
import com.amqploghook.core.format.LogFormatter;
import com.amqploghook.core.format.LogFormatters;
import com.amqploghook.core.hook.LevelHooks;
import com.amqploghook.infra.amqp.hook.AmqpLogHook;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logback appender that hands every event to the registered {@link LevelHooks}.
 *
 * <p>Hook failures are reported to the Logback status manager and never reach the code that
 * logged. Events from the RabbitMQ client and from this library are skipped so that publishing
 * cannot feed back into itself. Appends are not serialized: each logging thread fires the hooks
 * on its own, so one slow broker round trip does not block other threads.
 *
 * <p>When no {@link LevelHooks} is supplied, {@link #start()} builds a single {@link AmqpLogHook}
 * from the appender's properties, which allows configuration from {@code logback.xml}:
 *
 * <pre>
 * &lt;appender name="AMQP" class="com.amqploghook.infra.amqp.logback.AmqpHookAppender"&gt;
 *   &lt;server&gt;localhost:5672&lt;/server&gt;
 *   &lt;exchange&gt;logs&lt;/exchange&gt;
 *   &lt;routingKey&gt;app.error&lt;/routingKey&gt;
 * &lt;/appender&gt;
 * </pre>
 */
public class AmqpHookAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {
  static final String FIELD_LOGGER = "logger";
  static final String FIELD_THREAD = "thread";
  static final String FIELD_ERROR = "error";

  private static final List<String> EXCLUDED_LOGGER_PREFIXES =
      List.of("com.rabbitmq.", "com.amqploghook.");

  private LevelHooks levelHooks;
  private LogFormatter defaultFormatter;

  private String server;
  private String username = "guest";
  private String password = "guest";
  private String virtualHost = "";
  private String exchange;
  private String exchangeType = AmqpLogHook.DEFAULT_EXCHANGE_TYPE;
  private String routingKey = "";
  private boolean durable = true;
  private boolean autoDeleted;
  private boolean internal;
  private boolean noWait;
  private boolean mandatory;
  private boolean immediate;
  private String contentType = AmqpLogHook.DEFAULT_CONTENT_TYPE;
  private String formatterType = LogFormatters.JSON;
  private boolean includeTimestamp = true;

  public AmqpHookAppender() {}

  public AmqpHookAppender(LevelHooks levelHooks, LogFormatter defaultFormatter) {
    this.levelHooks = levelHooks;
    this.defaultFormatter = defaultFormatter;
  }

  @Override
  public void start() {
    try {
      if (defaultFormatter == null) {
        defaultFormatter =
            LogFormatters.create(formatterType, includeTimestamp, new ObjectMapper());
      }
      if (levelHooks == null) {
        if (isBlank(server) || isBlank(exchange)) {
          addError("Both server and exchange must be set for appender [" + getName() + "]");
          return;
        }
        levelHooks = new LevelHooks().add(buildHook());
      }
    } catch (IllegalArgumentException ex) {
      addError("Invalid AMQP hook configuration for appender [" + getName() + "]", ex);
      return;
    }
    super.start();
  }

  @Override
  protected void append(ILoggingEvent event) {
    if (isExcluded(event.getLoggerName())) {
      return;
    }
    LogLevel level = toLogLevel(event.getLevel());
    LogEntry entry =
        new LogEntry(
            level,
            event.getFormattedMessage(),
            fieldsOf(event),
            Instant.ofEpochMilli(event.getTimeStamp()),
            defaultFormatter);
    try {
      levelHooks.fire(level, entry);
    } catch (RuntimeException ex) {
      addError("Failed to fire hook", ex);
    }
  }

  static LogLevel toLogLevel(Level level) {
    if (level == null) {
      return LogLevel.INFO;
    }
    return switch (level.toInt()) {
      case Level.ERROR_INT -> LogLevel.ERROR;
      case Level.WARN_INT -> LogLevel.WARN;
      case Level.INFO_INT -> LogLevel.INFO;
      default -> LogLevel.DEBUG;
    };
  }

  private static Map<String, Object> fieldsOf(ILoggingEvent event) {
    Map<String, Object> fields = new LinkedHashMap<>();
    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null) {
      fields.putAll(mdc);
    }
    fields.put(FIELD_LOGGER, event.getLoggerName());
    fields.put(FIELD_THREAD, event.getThreadName());
    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      String message = throwable.getMessage();
      fields.put(
          FIELD_ERROR,
          message == null ? throwable.getClassName() : throwable.getClassName() + ": " + message);
    }
    return fields;
  }

  private AmqpLogHook buildHook() {
    return new AmqpLogHook(
            server, username, password, exchange, exchangeType, virtualHost, routingKey)
        .withDurable(durable)
        .withAutoDeleted(autoDeleted)
        .withInternal(internal)
        .withNoWait(noWait)
        .withMandatory(mandatory)
        .withImmediate(immediate)
        .withContentType(contentType);
  }

  private static boolean isExcluded(String loggerName) {
    if (loggerName == null) {
      return false;
    }
    for (String prefix : EXCLUDED_LOGGER_PREFIXES) {
      if (loggerName.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public LevelHooks getLevelHooks() {
    return levelHooks;
  }

  public LogFormatter getDefaultFormatter() {
    return defaultFormatter;
  }

  public void setServer(String server) {
    this.server = server;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public void setVirtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
  }

  public void setExchange(String exchange) {
    this.exchange = exchange;
  }

  public void setExchangeType(String exchangeType) {
    this.exchangeType = exchangeType;
  }

  public void setRoutingKey(String routingKey) {
    this.routingKey = routingKey;
  }

  public void setDurable(boolean durable) {
    this.durable = durable;
  }

  public void setAutoDeleted(boolean autoDeleted) {
    this.autoDeleted = autoDeleted;
  }

  public void setInternal(boolean internal) {
    this.internal = internal;
  }

  public void setNoWait(boolean noWait) {
    this.noWait = noWait;
  }

  public void setMandatory(boolean mandatory) {
    this.mandatory = mandatory;
  }

  public void setImmediate(boolean immediate) {
    this.immediate = immediate;
  }

  public void setContentType(String contentType) {
    this.contentType = contentType;
  }

  public void setFormatterType(String formatterType) {
    this.formatterType = formatterType;
  }

  public void setIncludeTimestamp(boolean includeTimestamp) {
    this.includeTimestamp = includeTimestamp;
  }
}
