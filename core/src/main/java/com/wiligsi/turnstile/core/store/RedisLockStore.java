package com.wiligsi.turnstile.core.store;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;

import com.google.protobuf.InvalidProtocolBufferException;
import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.config.LockStoreConfig;
import com.wiligsi.turnstile.core.config.LockStoreEndpoint;
import java.util.Optional;
import java.util.logging.Logger;
import org.redisson.Redisson;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

/**
 * Keeps locks in redis so that every worker pointed at the same database sees the same queues.
 * Each lock is one key holding the serialized {@link ConversationLockData}; writes use redis'
 * atomic compare-and-set on the whole value.
 *
 * @author Steven Miller
 */
public class RedisLockStore extends AbstractLockStore {

  private static final Logger LOG = Logger.getLogger(RedisLockStore.class.getName());

  private final RedissonClient client;
  private final String keyPrefix;
  private final boolean ownsClient;

  public RedisLockStore(RedissonClient client, String keyPrefix, LockStoreConfig config) {
    this(client, keyPrefix, config, false);
  }

  private RedisLockStore(
      RedissonClient client,
      String keyPrefix,
      LockStoreConfig config,
      boolean ownsClient
  ) {
    super(config);
    this.client = client;
    this.keyPrefix = keyPrefix == null ? LockStoreEndpoint.DEFAULT_KEY_PREFIX : keyPrefix;
    this.ownsClient = ownsClient;
  }

  /**
   * Connect to the redis server an endpoint describes. The connection is closed with the store.
   *
   * @param endpoint - where redis runs
   * @param config   - settings shared by all stores
   * @return a connected store
   * @throws StoreUnavailableException if redis can't be reached
   */
  public static RedisLockStore connect(LockStoreEndpoint endpoint, LockStoreConfig config)
      throws StoreUnavailableException {
    final Config redissonConfig = new Config();
    final SingleServerConfig server = redissonConfig.useSingleServer()
        .setAddress(endpoint.redisAddress())
        .setDatabase(endpoint.getDb());
    endpoint.getPassword().ifPresent(server::setPassword);

    try {
      final RedissonClient client = Redisson.create(redissonConfig);
      LOG.info(String.format("Connected to redis lock store at %s", endpoint.target()));
      return new RedisLockStore(client, endpoint.getKeyPrefix(), config, true);
    } catch (RedisException redisException) {
      throw new StoreUnavailableException(null, redisException);
    }
  }

  public String keyFor(String conversationId) {
    return keyPrefix + conversationId;
  }

  @Override
  protected Optional<ConversationLockData> readLockData(String conversationId)
      throws StoreUnavailableException {
    try {
      final byte[] serialized = bucket(conversationId).get();
      if (serialized == null) {
        return Optional.empty();
      }
      return Optional.of(ConversationLockData.parseFrom(serialized));
    } catch (RedisException | InvalidProtocolBufferException exception) {
      throw new StoreUnavailableException(conversationId, exception);
    }
  }

  @Override
  protected boolean compareAndSwapLockData(
      String conversationId,
      ConversationLockData expected,
      ConversationLockData updated
  ) throws StoreUnavailableException {
    try {
      return bucket(conversationId).compareAndSet(
          expected == null ? null : expected.toByteArray(),
          updated == null ? null : updated.toByteArray()
      );
    } catch (RedisException redisException) {
      throw new StoreUnavailableException(conversationId, redisException);
    }
  }

  @Override
  public boolean isSharedAcrossProcesses() {
    return true;
  }

  @Override
  public void close() {
    if (ownsClient && !client.isShutdown()) {
      client.shutdown();
      LOG.info("Disconnected from redis lock store");
    }
  }

  private RBucket<byte[]> bucket(String conversationId) {
    return client.getBucket(keyFor(conversationId), ByteArrayCodec.INSTANCE);
  }
}
