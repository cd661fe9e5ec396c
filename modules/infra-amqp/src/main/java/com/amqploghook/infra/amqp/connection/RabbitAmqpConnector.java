package com.amqploghook.infra.amqp.connection;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Opens one RabbitMQ connection per call.
 *
 * <p>The factory is configured from the parts of the {@link AmqpConnectionUri} rather than its
 * string form, so credentials containing {@code @}, {@code :} or {@code /} reach the broker
 * unchanged. The server is split at its last {@code :} into host and port; without a port the
 * client default applies. An empty virtual host connects to the broker's default virtual host
 * {@code /}.
 * The connection timeout is only applied when positive; otherwise the client default holds.
 */
public class RabbitAmqpConnector implements AmqpConnector {
  static final String DEFAULT_VIRTUAL_HOST = "/";

  private final Duration connectionTimeout;
  private final Supplier<ConnectionFactory> connectionFactorySupplier;

  public RabbitAmqpConnector() {
    this(Duration.ZERO);
  }

  public RabbitAmqpConnector(Duration connectionTimeout) {
    this(connectionTimeout, ConnectionFactory::new);
  }

  public RabbitAmqpConnector(
      Duration connectionTimeout, Supplier<ConnectionFactory> connectionFactorySupplier) {
    this.connectionTimeout = connectionTimeout == null ? Duration.ZERO : connectionTimeout;
    this.connectionFactorySupplier =
        Objects.requireNonNull(
            connectionFactorySupplier, "connectionFactorySupplier must not be null");
  }

  @Override
  public Connection connect(AmqpConnectionUri uri) throws IOException, TimeoutException {
    ConnectionFactory factory = connectionFactorySupplier.get();
    applyServer(factory, uri);
    factory.setUsername(uri.username());
    factory.setPassword(uri.password());
    factory.setVirtualHost(
        uri.virtualHost().isEmpty() ? DEFAULT_VIRTUAL_HOST : uri.virtualHost());
    if (!connectionTimeout.isZero() && !connectionTimeout.isNegative()) {
      factory.setConnectionTimeout((int) Math.min(Integer.MAX_VALUE, connectionTimeout.toMillis()));
    }
    factory.setAutomaticRecoveryEnabled(false);
    return factory.newConnection();
  }

  private static void applyServer(ConnectionFactory factory, AmqpConnectionUri uri)
      throws IOException {
    String server = uri.server();
    String host = server;
    String port = null;
    int separator = server.lastIndexOf(':');
    if (separator >= 0 && server.indexOf(']', separator) < 0) {
      host = server.substring(0, separator);
      port = server.substring(separator + 1);
    }
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    if (host.isBlank() || host.chars().anyMatch(Character::isWhitespace)) {
      throw invalid(uri, "missing or malformed host");
    }
    factory.setHost(host);
    if (port != null) {
      factory.setPort(parsePort(uri, port));
    }
  }

  private static int parsePort(AmqpConnectionUri uri, String port) throws IOException {
    try {
      int value = Integer.parseInt(port);
      if (value < 1 || value > 65535) {
        throw invalid(uri, "port out of range");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new IOException("Invalid AMQP connection URI " + uri.redacted() + ": bad port", ex);
    }
  }

  private static IOException invalid(AmqpConnectionUri uri, String reason) {
    return new IOException("Invalid AMQP connection URI " + uri.redacted() + ": " + reason);
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }
}
