package com.amqploghook.infra.amqp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.amqp.log-hook")
public class AmqpLogHookProperties {
  private boolean enabled = true;
  private String server = "localhost:5672";
  private String username = "guest";
  private String password = "guest";
  private String virtualHost = "";
  private String routingKey = "";
  private long connectionTimeoutMs = 0L;
  private Exchange exchange = new Exchange();
  private Publish publish = new Publish();
  private Formatter formatter = new Formatter();
  private Appender appender = new Appender();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getServer() {
    return server;
  }

  public void setServer(String server) {
    this.server = server;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getVirtualHost() {
    return virtualHost;
  }

  public void setVirtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  public void setRoutingKey(String routingKey) {
    this.routingKey = routingKey;
  }

  public long getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  public void setConnectionTimeoutMs(long connectionTimeoutMs) {
    this.connectionTimeoutMs = connectionTimeoutMs;
  }

  public Exchange getExchange() {
    return exchange;
  }

  public void setExchange(Exchange exchange) {
    this.exchange = exchange;
  }

  public Publish getPublish() {
    return publish;
  }

  public void setPublish(Publish publish) {
    this.publish = publish;
  }

  public Formatter getFormatter() {
    return formatter;
  }

  public void setFormatter(Formatter formatter) {
    this.formatter = formatter;
  }

  public Appender getAppender() {
    return appender;
  }

  public void setAppender(Appender appender) {
    this.appender = appender;
  }

  public static class Exchange {
    private String name = "logs";
    private String type = "direct";
    private boolean durable = true;
    private boolean autoDeleted = false;
    private boolean internal = false;
    private boolean noWait = false;

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public boolean isDurable() {
      return durable;
    }

    public void setDurable(boolean durable) {
      this.durable = durable;
    }

    public boolean isAutoDeleted() {
      return autoDeleted;
    }

    public void setAutoDeleted(boolean autoDeleted) {
      this.autoDeleted = autoDeleted;
    }

    public boolean isInternal() {
      return internal;
    }

    public void setInternal(boolean internal) {
      this.internal = internal;
    }

    public boolean isNoWait() {
      return noWait;
    }

    public void setNoWait(boolean noWait) {
      this.noWait = noWait;
    }
  }

  public static class Publish {
    private boolean mandatory = false;
    private boolean immediate = false;
    private String contentType = "text/plain";

    public boolean isMandatory() {
      return mandatory;
    }

    public void setMandatory(boolean mandatory) {
      this.mandatory = mandatory;
    }

    public boolean isImmediate() {
      return immediate;
    }

    public void setImmediate(boolean immediate) {
      this.immediate = immediate;
    }

    public String getContentType() {
      return contentType;
    }

    public void setContentType(String contentType) {
      this.contentType = contentType;
    }
  }

  public static class Formatter {
    private String type = "json";
    private boolean includeTimestamp = true;

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public boolean isIncludeTimestamp() {
      return includeTimestamp;
    }

    public void setIncludeTimestamp(boolean includeTimestamp) {
      this.includeTimestamp = includeTimestamp;
    }
  }

  public static class Appender {
    private boolean attachToRootLogger = false;
    private String name = "AMQP";

    public boolean isAttachToRootLogger() {
      return attachToRootLogger;
    }

    public void setAttachToRootLogger(boolean attachToRootLogger) {
      this.attachToRootLogger = attachToRootLogger;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }
  }
}
