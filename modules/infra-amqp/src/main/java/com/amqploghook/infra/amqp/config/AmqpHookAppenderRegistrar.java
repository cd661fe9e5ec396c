package com.amqploghook.infra.amqp.config;

import ch.qos.logback.classic.LoggerContext;
import com.amqploghook.core.format.LogFormatter;
import com.amqploghook.core.hook.LevelHooks;
import com.amqploghook.infra.amqp.logback.AmqpHookAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

/** Attaches an {@link AmqpHookAppender} to the Logback root logger for the context lifetime. */
public class AmqpHookAppenderRegistrar implements InitializingBean, DisposableBean {
  private static final Logger log = LoggerFactory.getLogger(AmqpHookAppenderRegistrar.class);

  private final LevelHooks levelHooks;
  private final LogFormatter defaultFormatter;
  private final String appenderName;

  private AmqpHookAppender appender;
  private ch.qos.logback.classic.Logger rootLogger;

  public AmqpHookAppenderRegistrar(
      LevelHooks levelHooks, LogFormatter defaultFormatter, String appenderName) {
    this.levelHooks = levelHooks;
    this.defaultFormatter = defaultFormatter;
    this.appenderName = appenderName == null || appenderName.isBlank() ? "AMQP" : appenderName;
  }

  @Override
  public void afterPropertiesSet() {
    ILoggerFactory loggerFactory = LoggerFactory.getILoggerFactory();
    if (!(loggerFactory instanceof LoggerContext loggerContext)) {
      log.warn(
          "Logback is not the active SLF4J backend, appender={} not attached backend={}",
          appenderName,
          loggerFactory.getClass().getName());
      return;
    }

    AmqpHookAppender created = new AmqpHookAppender(levelHooks, defaultFormatter);
    created.setName(appenderName);
    created.setContext(loggerContext);
    created.start();

    rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
    rootLogger.addAppender(created);
    appender = created;
    log.info("Attached AMQP log hook appender={} to root logger", appenderName);
  }

  @Override
  public void destroy() {
    if (appender == null) {
      return;
    }
    rootLogger.detachAppender(appender);
    appender.stop();
    appender = null;
    log.info("Detached AMQP log hook appender={} from root logger", appenderName);
  }

  public AmqpHookAppender getAppender() {
    return appender;
  }
}
