package com.wiligsi.turnstile.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Connection settings for a lock store backend. The abstraction stays backend neutral: the type
 * picks the backend and the remaining fields are read by whichever backend needs them.
 *
 * <p>Endpoints are usually loaded from a properties file:</p>
 * <pre>
 * lock_store.type=redis
 * lock_store.url=redis.internal
 * lock_store.port=6379
 * lock_store.db=1
 * lock_store.use_ssl=true
 * </pre>
 *
 * @author Steven Miller
 */
public final class LockStoreEndpoint {

  public static final String PREFIX = "lock_store.";
  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_REDIS_PORT = 6379;
  public static final int DEFAULT_DB = 1;
  public static final String DEFAULT_KEY_PREFIX = "lock:";

  private final String type;
  private final String host;
  private final int port;
  private final int db;
  private final String password;
  private final boolean useSsl;
  private final String keyPrefix;

  private LockStoreEndpoint(Builder builder) {
    this.type = builder.type;
    this.host = builder.host;
    this.port = builder.port;
    this.db = builder.db;
    this.password = builder.password;
    this.useSsl = builder.useSsl;
    this.keyPrefix = builder.keyPrefix;
  }

  public static LockStoreEndpoint inMemory() {
    return newBuilder(LockStoreKind.IN_MEMORY.getTypeName()).build();
  }

  public static Builder newBuilder(String type) {
    return new Builder(type);
  }

  /**
   * Read an endpoint from properties using the {@value #PREFIX} keys. A missing type means the
   * in-memory store.
   *
   * @param properties - the loaded properties
   * @return the endpoint described by the properties
   * @throws IllegalArgumentException if a numeric setting is not a number
   */
  public static LockStoreEndpoint fromProperties(Properties properties) {
    final Builder builder = newBuilder(
        properties.getProperty(PREFIX + "type", LockStoreKind.IN_MEMORY.getTypeName())
    );
    builder.setHost(properties.getProperty(PREFIX + "url", DEFAULT_HOST));
    builder.setPort(readInt(properties, "port", DEFAULT_REDIS_PORT));
    builder.setDb(readInt(properties, "db", DEFAULT_DB));
    builder.setPassword(properties.getProperty(PREFIX + "password"));
    builder.setUseSsl(
        Boolean.parseBoolean(properties.getProperty(PREFIX + "use_ssl", "false").trim())
    );
    builder.setKeyPrefix(properties.getProperty(PREFIX + "key_prefix", DEFAULT_KEY_PREFIX));
    return builder.build();
  }

  /**
   * Load an endpoint from a properties file.
   *
   * @param file - the endpoint file
   * @return the endpoint described by the file
   * @throws IOException if the file can't be read
   */
  public static LockStoreEndpoint load(Path file) throws IOException {
    final Properties properties = new Properties();
    try (InputStream in = Files.newInputStream(file)) {
      properties.load(in);
    }
    return fromProperties(properties);
  }

  public String getType() {
    return type;
  }

  public Optional<LockStoreKind> getKind() {
    return LockStoreKind.fromTypeName(type);
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public int getDb() {
    return db;
  }

  public Optional<String> getPassword() {
    return Optional.ofNullable(password);
  }

  public boolean isUseSsl() {
    return useSsl;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  /**
   * The address string for a redis connection, e.g. {@code rediss://cache:6380}.
   *
   * @return the redis address for this endpoint
   */
  public String redisAddress() {
    return (useSsl ? "rediss://" : "redis://") + host + ":" + port;
  }

  /**
   * The gRPC target for a remote turnstile server, e.g. {@code locks.internal:50051}.
   *
   * @return the host and port
   */
  public String target() {
    return host + ":" + port;
  }

  @Override
  public String toString() {
    // password left out on purpose
    return String.format(
        "LockStoreEndpoint{type='%s', host='%s', port=%d, db=%d, useSsl=%s, keyPrefix='%s'}",
        type, host, port, db, useSsl, keyPrefix
    );
  }

  private static int readInt(Properties properties, String key, int defaultValue) {
    final String raw = properties.getProperty(PREFIX + key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException formatException) {
      throw new IllegalArgumentException(
          String.format("'%s%s' must be a number but was '%s'", PREFIX, key, raw),
          formatException
      );
    }
  }

  public static final class Builder {

    private final String type;
    private String host = DEFAULT_HOST;
    private int port = DEFAULT_REDIS_PORT;
    private int db = DEFAULT_DB;
    private String password;
    private boolean useSsl;
    private String keyPrefix = DEFAULT_KEY_PREFIX;

    private Builder(String type) {
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("Lock store type must not be blank");
      }
      this.type = type.trim().toLowerCase(Locale.ROOT);
    }

    public Builder setHost(String host) {
      this.host = host;
      return this;
    }

    public Builder setPort(int port) {
      this.port = port;
      return this;
    }

    public Builder setDb(int db) {
      this.db = db;
      return this;
    }

    public Builder setPassword(String password) {
      this.password = password;
      return this;
    }

    public Builder setUseSsl(boolean useSsl) {
      this.useSsl = useSsl;
      return this;
    }

    public Builder setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
      return this;
    }

    public LockStoreEndpoint build() {
      return new LockStoreEndpoint(this);
    }
  }
}
