package com.amqploghook.infra.amqp.connection;

import java.util.Objects;

public record AmqpConnectionUri(
    String server, String username, String password, String virtualHost) {
  private static final String SCHEME = "amqp://";
  private static final String REDACTED_PASSWORD = "****";

  public AmqpConnectionUri {
    Objects.requireNonNull(server, "server must not be null");
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    virtualHost = virtualHost == null ? "" : virtualHost;
  }

  // Credentials and virtual host are written as given, without percent-encoding.
  public String toUriString() {
    return format(password);
  }

  public String redacted() {
    return format(REDACTED_PASSWORD);
  }

  @Override
  public String toString() {
    return redacted();
  }

  private String format(String passwordText) {
    return SCHEME + username + ":" + passwordText + "@" + server + "/" + virtualHost;
  }
}
