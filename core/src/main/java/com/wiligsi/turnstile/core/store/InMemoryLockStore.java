package com.wiligsi.turnstile.core.store;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;

import com.wiligsi.turnstile.core.config.LockStoreConfig;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps every lock in a map inside this process. Only callers in the same process see the same
 * locks, so this store is never shared across workers.
 *
 * @author Steven Miller
 */
public class InMemoryLockStore extends AbstractLockStore {

  private final ConcurrentMap<String, ConversationLockData> locks;

  public InMemoryLockStore() {
    this(LockStoreConfig.defaults());
  }

  public InMemoryLockStore(LockStoreConfig config) {
    super(config);
    locks = new ConcurrentHashMap<>();
  }

  @Override
  protected Optional<ConversationLockData> readLockData(String conversationId) {
    return Optional.ofNullable(locks.get(conversationId));
  }

  @Override
  protected boolean compareAndSwapLockData(
      String conversationId,
      ConversationLockData expected,
      ConversationLockData updated
  ) {
    if (expected == null) {
      return updated == null
          ? !locks.containsKey(conversationId)
          : locks.putIfAbsent(conversationId, updated) == null;
    }
    if (updated == null) {
      return locks.remove(conversationId, expected);
    }
    return locks.replace(conversationId, expected, updated);
  }

  @Override
  public boolean isSharedAcrossProcesses() {
    return false;
  }

  public int size() {
    return locks.size();
  }
}
