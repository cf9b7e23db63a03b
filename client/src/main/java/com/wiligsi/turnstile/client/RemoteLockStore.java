package com.wiligsi.turnstile.client;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;

import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.config.LockStoreConfig;
import com.wiligsi.turnstile.core.config.LockStoreEndpoint;
import com.wiligsi.turnstile.core.config.LockStoreFactory;
import com.wiligsi.turnstile.core.store.AbstractLockStore;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A lock store backed by a turnstile server. Every worker that talks to the same server shares
 * its locks; the server decides which of two racing writes wins.
 *
 * @author Steven Miller
 */
public class RemoteLockStore extends AbstractLockStore {

  public static final String TYPE_NAME = "remote";

  private static final Logger LOG = Logger.getLogger(RemoteLockStore.class.getName());

  private final TurnstileClient client;
  private final ManagedChannel ownedChannel;

  public RemoteLockStore(TurnstileClient client, LockStoreConfig config) {
    this(client, config, null);
  }

  private RemoteLockStore(
      TurnstileClient client,
      LockStoreConfig config,
      ManagedChannel ownedChannel
  ) {
    super(config);
    this.client = client;
    this.ownedChannel = ownedChannel;
  }

  /**
   * Open a channel to the server an endpoint describes. The channel is closed with the store.
   *
   * @param endpoint - where the server runs
   * @param config   - settings shared by all stores
   * @return a store using the new channel
   */
  public static RemoteLockStore connect(LockStoreEndpoint endpoint, LockStoreConfig config) {
    final ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forTarget(endpoint.target());
    if (endpoint.isUseSsl()) {
      builder.useTransportSecurity();
    } else {
      builder.usePlaintext();
    }
    final ManagedChannel channel = builder.build();
    LOG.info(String.format("Using turnstile server at %s", endpoint.target()));
    return new RemoteLockStore(new TurnstileClient(channel), config, channel);
  }

  /**
   * Make the {@value #TYPE_NAME} store type available to a factory.
   *
   * @param factory - the factory to extend
   * @return the same factory
   */
  public static LockStoreFactory register(LockStoreFactory factory) {
    return factory.register(TYPE_NAME, RemoteLockStore::connect);
  }

  @Override
  protected Optional<ConversationLockData> readLockData(String conversationId)
      throws StoreUnavailableException {
    try {
      return client.getLock(conversationId);
    } catch (StatusRuntimeException statusException) {
      throw unavailable(conversationId, statusException);
    }
  }

  @Override
  protected boolean compareAndSwapLockData(
      String conversationId,
      ConversationLockData expected,
      ConversationLockData updated
  ) throws StoreUnavailableException {
    try {
      return client.swapLock(conversationId, expected, updated);
    } catch (StatusRuntimeException statusException) {
      throw unavailable(conversationId, statusException);
    }
  }

  /**
   * The conversations the server currently holds a lock for.
   *
   * @return conversation ids in alphabetical order
   * @throws StoreUnavailableException if the server can't be reached
   */
  public List<String> listConversations() throws StoreUnavailableException {
    try {
      return client.listLocks();
    } catch (StatusRuntimeException statusException) {
      throw unavailable(null, statusException);
    }
  }

  @Override
  public boolean isSharedAcrossProcesses() {
    return true;
  }

  @Override
  public void close() {
    if (ownedChannel == null) {
      return;
    }
    ownedChannel.shutdown();
    try {
      if (!ownedChannel.awaitTermination(5, TimeUnit.SECONDS)) {
        ownedChannel.shutdownNow();
      }
    } catch (InterruptedException interruptedException) {
      ownedChannel.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private StoreUnavailableException unavailable(
      String conversationId,
      StatusRuntimeException statusException
  ) {
    LOG.log(
        Level.SEVERE,
        String.format("Turnstile server call failed with %s", statusException.getStatus()),
        statusException
    );
    return new StoreUnavailableException(conversationId, statusException);
  }
}
