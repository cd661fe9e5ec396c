package com.amqploghook.infra.amqp.hook;

import com.amqploghook.core.LogEntry;
import com.amqploghook.core.LogLevel;
import com.amqploghook.core.format.LogFormatException;
import com.amqploghook.core.format.LogFormatter;
import com.amqploghook.core.hook.LogHook;
import com.amqploghook.infra.amqp.connection.AmqpConnectionUri;
import com.amqploghook.infra.amqp.connection.AmqpConnector;
import com.amqploghook.infra.amqp.connection.RabbitAmqpConnector;
import com.amqploghook.infra.amqp.observability.LogHookTelemetry;
import com.amqploghook.infra.amqp.observability.NoOpLogHookTelemetry;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards log entries to an AMQP exchange.
 *
 * <p>Every {@link #fire(LogEntry)} opens its own connection and channel, declares the exchange,
 * publishes one message and closes both again. There is no pooling, buffering or retry; the
 * first failure is thrown as an {@link AmqpLogHookException}.
 *
 * <p>The {@code with*} methods mutate this instance and are meant for setup, before the hook is
 * shared between logging threads.
 */
public class AmqpLogHook implements LogHook {
  private static final Logger log = LoggerFactory.getLogger(AmqpLogHook.class);

  public static final String DEFAULT_EXCHANGE_TYPE = "direct";
  public static final String DEFAULT_CONTENT_TYPE = "text/plain";

  private static final byte[] EMPTY_BODY = new byte[0];

  private final String server;
  private final String username;
  private final String password;
  private final String exchange;
  private final String exchangeType;
  private final String virtualHost;
  private final String routingKey;

  private boolean durable = true;
  private boolean autoDeleted;
  private boolean internal;
  private boolean noWait;
  private boolean mandatory;
  private boolean immediate;

  private String contentType = DEFAULT_CONTENT_TYPE;
  private LogFormatter formatter;
  private AmqpConnector connector = new RabbitAmqpConnector();
  private LogHookTelemetry telemetry = new NoOpLogHookTelemetry();

  public AmqpLogHook(
      String server, String username, String password, String exchange, String routingKey) {
    this(server, username, password, exchange, DEFAULT_EXCHANGE_TYPE, "", routingKey);
  }

  public AmqpLogHook(
      String server,
      String username,
      String password,
      String exchange,
      String exchangeType,
      String virtualHost,
      String routingKey) {
    this.server = Objects.requireNonNull(server, "server must not be null");
    this.username = username;
    this.password = password;
    this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
    this.exchangeType = Objects.requireNonNull(exchangeType, "exchangeType must not be null");
    this.virtualHost = virtualHost == null ? "" : virtualHost;
    this.routingKey = routingKey == null ? "" : routingKey;
  }

  public AmqpLogHook withFormatter(LogFormatter formatter) {
    this.formatter = formatter;
    return this;
  }

  public AmqpLogHook withContentType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      throw new IllegalArgumentException("contentType must not be blank");
    }
    this.contentType = contentType;
    return this;
  }

  public AmqpLogHook withDurable(boolean durable) {
    this.durable = durable;
    return this;
  }

  public AmqpLogHook withAutoDeleted(boolean autoDeleted) {
    this.autoDeleted = autoDeleted;
    return this;
  }

  public AmqpLogHook withInternal(boolean internal) {
    this.internal = internal;
    return this;
  }

  public AmqpLogHook withNoWait(boolean noWait) {
    this.noWait = noWait;
    return this;
  }

  public AmqpLogHook withMandatory(boolean mandatory) {
    this.mandatory = mandatory;
    return this;
  }

  public AmqpLogHook withImmediate(boolean immediate) {
    this.immediate = immediate;
    return this;
  }

  public AmqpLogHook withConnector(AmqpConnector connector) {
    this.connector = Objects.requireNonNull(connector, "connector must not be null");
    return this;
  }

  public AmqpLogHook withTelemetry(LogHookTelemetry telemetry) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    return this;
  }

  @Override
  public List<LogLevel> levels() {
    return LogLevel.all();
  }

  @Override
  public void fire(LogEntry entry) {
    Objects.requireNonNull(entry, "entry must not be null");
    long started = System.nanoTime();
    try {
      send(entry);
    } catch (AmqpLogHookException ex) {
      telemetry.onPublishFailure(
          exchange, routingKey, entry.level().label(), ex.stage().name(), ex);
      throw ex;
    }
    telemetry.onPublishSuccess(
        exchange, routingKey, entry.level().label(), System.nanoTime() - started);
  }

  public AmqpConnectionUri connectionUri() {
    return new AmqpConnectionUri(server, username, password, virtualHost);
  }

  private void send(LogEntry entry) {
    AmqpConnectionUri uri = connectionUri();
    Connection connection = connect(uri);
    try {
      Channel channel = openChannel(connection);
      try {
        declareExchange(channel);
        byte[] body = format(entry);
        publish(channel, body);
        log.debug(
            "Published log entry to exchange={} routingKey={} level={} bytes={}",
            exchange,
            routingKey,
            entry.level(),
            body.length);
      } finally {
        closeChannel(channel);
      }
    } finally {
      closeConnection(connection);
    }
  }

  private Connection connect(AmqpConnectionUri uri) {
    try {
      return connector.connect(uri);
    } catch (IOException | TimeoutException | RuntimeException ex) {
      throw failure(FireStage.CONNECT, ex);
    }
  }

  private Channel openChannel(Connection connection) {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | RuntimeException ex) {
      throw failure(FireStage.CHANNEL, ex);
    }
    if (channel == null) {
      throw failure(FireStage.CHANNEL, new IOException("No channel available on connection"));
    }
    return channel;
  }

  private void declareExchange(Channel channel) {
    try {
      if (noWait) {
        channel.exchangeDeclareNoWait(exchange, exchangeType, durable, autoDeleted, internal, null);
      } else {
        channel.exchangeDeclare(exchange, exchangeType, durable, autoDeleted, internal, null);
      }
    } catch (IOException | RuntimeException ex) {
      throw failure(FireStage.DECLARE, ex);
    }
  }

  private byte[] format(LogEntry entry) {
    LogFormatter effective = formatter != null ? formatter : entry.loggerFormatter();
    byte[] body;
    try {
      body = effective.format(entry);
    } catch (LogFormatException | RuntimeException ex) {
      throw failure(FireStage.FORMAT, ex);
    }
    // Formatter output is not validated; no bytes publishes an empty message.
    return body == null ? EMPTY_BODY : body;
  }

  private void publish(Channel channel, byte[] body) {
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder().contentType(contentType).build();
    try {
      channel.basicPublish(exchange, routingKey, mandatory, immediate, properties, body);
    } catch (IOException | RuntimeException ex) {
      throw failure(FireStage.PUBLISH, ex);
    }
  }

  private AmqpLogHookException failure(FireStage stage, Exception cause) {
    String message =
        "Failed to "
            + stage.action()
            + " exchange="
            + exchange
            + " routingKey="
            + routingKey
            + " uri="
            + connectionUri().redacted();
    return new AmqpLogHookException(stage, exchange, routingKey, message, cause);
  }

  private void closeChannel(Channel channel) {
    try {
      channel.close();
    } catch (AlreadyClosedException ex) {
      log.debug("AMQP channel already closed exchange={} reason={}", exchange, ex.getMessage());
    } catch (IOException | TimeoutException | RuntimeException ex) {
      log.warn("Failed to close AMQP channel exchange={} error={}", exchange, ex.toString());
    }
  }

  private void closeConnection(Connection connection) {
    try {
      connection.close();
    } catch (AlreadyClosedException ex) {
      log.debug("AMQP connection already closed server={} reason={}", server, ex.getMessage());
    } catch (IOException | RuntimeException ex) {
      log.warn("Failed to close AMQP connection server={} error={}", server, ex.toString());
    }
  }

  public String getServer() {
    return server;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  public String getExchange() {
    return exchange;
  }

  public String getExchangeType() {
    return exchangeType;
  }

  public String getVirtualHost() {
    return virtualHost;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  public boolean isDurable() {
    return durable;
  }

  public boolean isAutoDeleted() {
    return autoDeleted;
  }

  public boolean isInternal() {
    return internal;
  }

  public boolean isNoWait() {
    return noWait;
  }

  public boolean isMandatory() {
    return mandatory;
  }

  public boolean isImmediate() {
    return immediate;
  }

  public String getContentType() {
    return contentType;
  }

  public LogFormatter getFormatter() {
    return formatter;
  }

  public AmqpConnector getConnector() {
    return connector;
  }

  public LogHookTelemetry getTelemetry() {
    return telemetry;
  }
}
