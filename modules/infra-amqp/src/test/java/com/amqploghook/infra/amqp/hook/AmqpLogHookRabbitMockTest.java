package com.amqploghook.infra.amqp.hook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.amqploghook.core.LogEntry;
import com.amqploghook.core.LogLevel;
import com.amqploghook.core.format.JsonLogFormatter;
import com.amqploghook.infra.amqp.connection.RabbitAmqpConnector;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.fridujo.rabbitmq.mock.MockConnectionFactory;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.GetResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AmqpLogHookRabbitMockTest {
  @Test
  void shouldDeliverFormattedEntryToBoundQueue() throws Exception {
    MockConnectionFactory connectionFactory = new MockConnectionFactory();
    try (Connection adminConnection = connectionFactory.newConnection();
        Channel adminChannel = adminConnection.createChannel()) {
      adminChannel.exchangeDeclare("logs", "direct", true);
      adminChannel.queueDeclare("app-errors", false, false, false, null);
      adminChannel.queueBind("app-errors", "logs", "app.error");

      AmqpLogHook hook =
          new AmqpLogHook("localhost:5672", "guest", "guest", "logs", "app.error")
              .withConnector(new RabbitAmqpConnector(Duration.ZERO, () -> connectionFactory));

      hook.fire(
          LogEntry.of(
              LogLevel.ERROR, "disk full", new JsonLogFormatter(new ObjectMapper(), false)));

      GetResponse response = adminChannel.basicGet("app-errors", true);
      assertNotNull(response);
      assertEquals("text/plain", response.getProps().getContentType());
      assertEquals(
          "{\"level\":\"error\",\"msg\":\"disk full\"}",
          new String(response.getBody(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void shouldRouteByKeyOnTopicExchange() throws Exception {
    MockConnectionFactory connectionFactory = new MockConnectionFactory();
    try (Connection adminConnection = connectionFactory.newConnection();
        Channel adminChannel = adminConnection.createChannel()) {
      adminChannel.exchangeDeclare("audit", "topic", true);
      adminChannel.queueDeclare("audit-all", false, false, false, null);
      adminChannel.queueBind("audit-all", "audit", "audit.#");

      AmqpLogHook hook =
          new AmqpLogHook("localhost:5672", "guest", "guest", "audit", "topic", "", "audit.login")
              .withContentType("application/json")
              .withConnector(new RabbitAmqpConnector(Duration.ZERO, () -> connectionFactory));

      hook.fire(
          LogEntry.of(LogLevel.INFO, "user login", new JsonLogFormatter(new ObjectMapper(), false))
              .withField("user", "alice"));

      GetResponse response = adminChannel.basicGet("audit-all", true);
      assertNotNull(response);
      assertEquals("application/json", response.getProps().getContentType());
      assertEquals(
          "{\"level\":\"info\",\"msg\":\"user login\",\"user\":\"alice\"}",
          new String(response.getBody(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void shouldDeliverEmptyMessageWhenFormatterProducesNoBytes() throws Exception {
    MockConnectionFactory connectionFactory = new MockConnectionFactory();
    try (Connection adminConnection = connectionFactory.newConnection();
        Channel adminChannel = adminConnection.createChannel()) {
      adminChannel.exchangeDeclare("logs", "direct", true);
      adminChannel.queueDeclare("app-info", false, false, false, null);
      adminChannel.queueBind("app-info", "logs", "app.info");

      AmqpLogHook hook =
          new AmqpLogHook("localhost:5672", "guest", "guest", "logs", "app.info")
              .withConnector(new RabbitAmqpConnector(Duration.ZERO, () -> connectionFactory));

      hook.fire(LogEntry.of(LogLevel.INFO, "x", entry -> null));

      GetResponse response = adminChannel.basicGet("app-info", true);
      assertNotNull(response);
      assertEquals(0, response.getBody().length);
    }
  }
}
