package com.amqploghook.infra.amqp.config;

import com.amqploghook.core.format.LogFormatter;
import com.amqploghook.core.format.LogFormatters;
import com.amqploghook.core.hook.LevelHooks;
import com.amqploghook.core.hook.LogHook;
import com.amqploghook.infra.amqp.connection.AmqpConnector;
import com.amqploghook.infra.amqp.connection.RabbitAmqpConnector;
import com.amqploghook.infra.amqp.hook.AmqpLogHook;
import com.amqploghook.infra.amqp.observability.LogHookTelemetry;
import com.amqploghook.infra.amqp.observability.MicrometerLogHookTelemetry;
import com.amqploghook.infra.amqp.observability.NoOpLogHookTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(name = "com.rabbitmq.client.ConnectionFactory")
@EnableConfigurationProperties(AmqpLogHookProperties.class)
public class AmqpLogHookAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "amqpLogObjectMapper")
  public ObjectMapper amqpLogObjectMapper() {
    return new ObjectMapper();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogFormatter amqpLogFormatter(
      @Qualifier("amqpLogObjectMapper") ObjectMapper amqpLogObjectMapper,
      AmqpLogHookProperties properties) {
    AmqpLogHookProperties.Formatter formatter = properties.getFormatter();
    return LogFormatters.create(
        formatter.getType(), formatter.isIncludeTimestamp(), amqpLogObjectMapper);
  }

  @Bean
  @ConditionalOnMissingBean(LogHookTelemetry.class)
  public LogHookTelemetry noOpLogHookTelemetry() {
    return new NoOpLogHookTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public AmqpConnector amqpConnector(AmqpLogHookProperties properties) {
    long timeoutMs = Math.max(0L, properties.getConnectionTimeoutMs());
    return new RabbitAmqpConnector(Duration.ofMillis(timeoutMs));
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.amqp.log-hook",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public AmqpLogHook amqpLogHook(
      AmqpLogHookProperties properties, AmqpConnector amqpConnector, LogHookTelemetry telemetry) {
    AmqpLogHookProperties.Exchange exchange = properties.getExchange();
    AmqpLogHookProperties.Publish publish = properties.getPublish();
    return new AmqpLogHook(
            properties.getServer(),
            properties.getUsername(),
            properties.getPassword(),
            exchange.getName(),
            exchange.getType(),
            properties.getVirtualHost(),
            properties.getRoutingKey())
        .withDurable(exchange.isDurable())
        .withAutoDeleted(exchange.isAutoDeleted())
        .withInternal(exchange.isInternal())
        .withNoWait(exchange.isNoWait())
        .withMandatory(publish.isMandatory())
        .withImmediate(publish.isImmediate())
        .withContentType(publish.getContentType())
        .withConnector(amqpConnector)
        .withTelemetry(telemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  public LevelHooks levelHooks(ObjectProvider<LogHook> hooks) {
    LevelHooks levelHooks = new LevelHooks();
    hooks.orderedStream().forEach(levelHooks::add);
    return levelHooks;
  }

  // Micrometer is optional, so its types stay out of this class's own method signatures.
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
  static class MicrometerTelemetryConfiguration {
    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(LogHookTelemetry.class)
    LogHookTelemetry micrometerLogHookTelemetry(MeterRegistry meterRegistry) {
      return new MicrometerLogHookTelemetry(meterRegistry);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "ch.qos.logback.classic.LoggerContext")
  @ConditionalOnProperty(
      prefix = "infra.amqp.log-hook.appender",
      name = "attach-to-root-logger",
      havingValue = "true")
  static class LogbackAppenderConfiguration {
    @Bean
    @ConditionalOnMissingBean
    AmqpHookAppenderRegistrar amqpHookAppenderRegistrar(
        LevelHooks levelHooks, LogFormatter amqpLogFormatter, AmqpLogHookProperties properties) {
      return new AmqpHookAppenderRegistrar(
          levelHooks, amqpLogFormatter, properties.getAppender().getName());
    }
  }
}
