package com.wiligsi.turnstile.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.config.LockStoreConfig;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;

@ExtendWith(MockitoExtension.class)
public class RedisLockStoreTests {

  private static final String CONVERSATION_ID = "conversation-9";

  @Mock
  private RedissonClient sharedClient;

  private FakeRedis redis;
  private RedisLockStore store;

  @BeforeEach
  public void setUp() {
    redis = new FakeRedis();
    store = new RedisLockStore(redis.client(), "tracker_lock:", LockStoreConfig.defaults());
  }

  @Test
  public void itShouldStoreLocksUnderThePrefixedKey() throws Exception {
    store.issueTicket(CONVERSATION_ID);

    assertThat(store.keyFor(CONVERSATION_ID)).isEqualTo("tracker_lock:conversation-9");
    assertThat(redis.containsKey("tracker_lock:conversation-9")).isTrue();
  }

  @Test
  public void itShouldShareLocksBetweenStoresOnTheSameServer() throws Exception {
    final RedisLockStore otherWorker =
        new RedisLockStore(redis.client(), "tracker_lock:", LockStoreConfig.defaults());

    store.issueTicket(CONVERSATION_ID);

    assertThat(otherWorker.issueTicket(CONVERSATION_ID)).isEqualTo(1);
  }

  @Test
  public void itShouldBeSharedAcrossProcesses() {
    assertThat(store.isSharedAcrossProcesses()).isTrue();
    assertThat(new InMemoryLockStore().isSharedAcrossProcesses()).isFalse();
  }

  @Test
  public void itShouldReportAnUnreachableServer() {
    redis.setDown(true);

    assertThatThrownBy(() -> store.issueTicket(CONVERSATION_ID))
        .isInstanceOf(StoreUnavailableException.class)
        .hasCauseInstanceOf(RedisException.class)
        .hasFieldOrPropertyWithValue("conversationId", CONVERSATION_ID);
  }

  @Test
  public void itShouldReportUnreadableLockState() {
    redis.put(store.keyFor(CONVERSATION_ID), "not a lock".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> store.getLock(CONVERSATION_ID))
        .isInstanceOf(StoreUnavailableException.class);
  }

  @Test
  public void itShouldLeaveAClientItDidNotCreateOpen() {
    final RedisLockStore borrowing =
        new RedisLockStore(sharedClient, null, LockStoreConfig.defaults());

    borrowing.close();

    assertThat(borrowing.keyFor(CONVERSATION_ID)).isEqualTo("lock:conversation-9");
    verify(sharedClient, never()).shutdown();
  }
}
