package com.amqploghook.infra.amqp.connection;

import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

@FunctionalInterface
public interface AmqpConnector {
  Connection connect(AmqpConnectionUri uri) throws IOException, TimeoutException;
}
