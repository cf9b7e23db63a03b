package com.wiligsi.turnstile.core;

import com.wiligsi.turnstile.core.lock.TicketStatus;
import com.wiligsi.turnstile.core.store.LockStore;
import com.wiligsi.turnstile.core.store.TicketLockHandle;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs work with exclusive, ordered access to a conversation. Work for the same conversation runs
 * one at a time in the order it was handed in; work for different conversations runs side by
 * side.
 *
 * <p>{@link #callLocked} blocks the calling thread. {@link #submitLocked} issues the ticket right
 * away, in the calling thread, and then checks the queue on a scheduler so no thread sits parked
 * while the ticket waits its turn. Either way the ticket is handed back however the work ends.</p>
 *
 * @author Steven Miller
 */
public class ConversationLocker implements AutoCloseable {

  private static final Logger LOG = Logger.getLogger(ConversationLocker.class.getName());

  private final LockStore store;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final ConcurrentMap<CompletableFuture<TicketLockHandle>, TicketLockHandle> waiting;
  private final AtomicBoolean closed;

  public ConversationLocker(LockStore store) {
    this(store, Executors.newScheduledThreadPool(1, new PollerThreadFactory()), true);
  }

  public ConversationLocker(LockStore store, ScheduledExecutorService scheduler) {
    this(store, scheduler, false);
  }

  private ConversationLocker(
      LockStore store,
      ScheduledExecutorService scheduler,
      boolean ownsScheduler
  ) {
    this.store = store;
    this.scheduler = scheduler;
    this.ownsScheduler = ownsScheduler;
    this.waiting = new ConcurrentHashMap<>();
    this.closed = new AtomicBoolean(false);
  }

  public LockStore getStore() {
    return store;
  }

  /**
   * Run work under the conversation's lock using the store's default wait time and lifetime.
   *
   * @param conversationId - the conversation to lock
   * @param region         - the work to run
   * @return whatever the work returned
   * @throws LockException        if the lock could not be acquired or released
   * @throws InterruptedException if the thread was interrupted while waiting
   * @throws E                    if the work failed; the lock is released first
   */
  public <T, E extends Exception> T callLocked(String conversationId, LockedRegion<T, E> region)
      throws LockException, InterruptedException, E {
    return callLocked(
        conversationId,
        store.getConfig().getWaitTime(),
        store.getConfig().getLockLifetime(),
        region
    );
  }

  public <T, E extends Exception> T callLocked(
      String conversationId,
      Duration waitTime,
      Duration lockLifetime,
      LockedRegion<T, E> region
  ) throws LockException, InterruptedException, E {
    try (TicketLockHandle handle = store.lock(conversationId, waitTime, lockLifetime)) {
      return region.run();
    }
  }

  /**
   * Issue a ticket now and complete once it is served. Completing the returned future
   * exceptionally, or cancelling it, hands the ticket back.
   *
   * @param conversationId - the conversation to lock
   * @param waitTime       - how long to wait between checks of the queue
   * @param lockLifetime   - how long the ticket stays valid
   * @return a future holding the served ticket, which the caller must close
   */
  public CompletableFuture<TicketLockHandle> acquireAsync(
      String conversationId,
      Duration waitTime,
      Duration lockLifetime
  ) {
    final CompletableFuture<TicketLockHandle> acquired = new CompletableFuture<>();
    if (closed.get()) {
      acquired.completeExceptionally(
          new LockException(conversationId, "Locker is closed, no ticket was issued")
      );
      return acquired;
    }

    final TicketLockHandle handle;
    try {
      handle = store.enqueue(conversationId, lockLifetime);
    } catch (LockException | RuntimeException enqueueException) {
      acquired.completeExceptionally(enqueueException);
      return acquired;
    }

    waiting.put(acquired, handle);
    acquired.whenComplete((served, failure) -> waiting.remove(acquired));
    if (closed.get()) {
      // closed while the ticket was being issued
      fail(handle, acquired, closedWhileWaiting(handle));
      return acquired;
    }

    try {
      scheduler.execute(() -> poll(handle, waitTime, acquired));
    } catch (RejectedExecutionException rejectedException) {
      LOG.warning(
          String.format(
              "Lock{%s}: Scheduler refused to poll ticket '%d'",
              conversationId, handle.getTicketNumber()
          )
      );
      fail(handle, acquired, rejectedException);
    }
    return acquired;
  }

  public <T> CompletableFuture<T> submitLocked(
      String conversationId,
      Supplier<? extends CompletionStage<T>> region
  ) {
    return submitLocked(
        conversationId,
        store.getConfig().getWaitTime(),
        store.getConfig().getLockLifetime(),
        region
    );
  }

  /**
   * Run asynchronous work under the conversation's lock. The ticket is issued before this method
   * returns, so work submitted earlier for the same conversation is always served earlier.
   *
   * @param conversationId - the conversation to lock
   * @param waitTime       - how long to wait between checks of the queue
   * @param lockLifetime   - how long the ticket stays valid
   * @param region         - starts the work once the lock is held
   * @return a future that completes with the work's result after the lock is released
   */
  public <T> CompletableFuture<T> submitLocked(
      String conversationId,
      Duration waitTime,
      Duration lockLifetime,
      Supplier<? extends CompletionStage<T>> region
  ) {
    return acquireAsync(conversationId, waitTime, lockLifetime)
        .thenCompose(handle -> runThenRelease(handle, region));
  }

  private void poll(
      TicketLockHandle handle,
      Duration waitTime,
      CompletableFuture<TicketLockHandle> acquired
  ) {
    if (acquired.isDone()) {
      // cancelled by the caller while waiting
      abandon(handle, null);
      return;
    }

    try {
      final TicketStatus status = handle.status();
      if (status == TicketStatus.SERVING) {
        if (!acquired.complete(handle)) {
          abandon(handle, null);
        }
        return;
      }

      if (status == TicketStatus.EXPIRED || handle.isExpired()) {
        LOG.warning(
            String.format(
                "Lock{%s}: Ticket '%d' expired while waiting",
                handle.getConversationId(), handle.getTicketNumber()
            )
        );
        fail(handle, acquired,
            new LockTimeoutException(handle.getConversationId(), handle.getTicketNumber()));
        return;
      }

      scheduler.schedule(
          () -> poll(handle, waitTime, acquired),
          handle.nextPollDelay(waitTime).toMillis(),
          TimeUnit.MILLISECONDS
      );
    } catch (LockException | RuntimeException pollException) {
      fail(handle, acquired, pollException);
    }
  }

  private <T> CompletableFuture<T> runThenRelease(
      TicketLockHandle handle,
      Supplier<? extends CompletionStage<T>> region
  ) {
    CompletionStage<T> stage;
    try {
      stage = region.get();
      if (stage == null) {
        stage = CompletableFuture.failedFuture(
            new NullPointerException("Locked region returned no completion stage")
        );
      }
    } catch (RuntimeException regionException) {
      stage = CompletableFuture.failedFuture(regionException);
    }

    final CompletableFuture<T> result = new CompletableFuture<>();
    stage.whenComplete((value, failure) -> {
      final Throwable regionFailure = unwrap(failure);
      try {
        handle.close();
      } catch (LockException releaseException) {
        if (regionFailure == null) {
          result.completeExceptionally(releaseException);
          return;
        }
        regionFailure.addSuppressed(releaseException);
      }

      if (regionFailure == null) {
        result.complete(value);
      } else {
        result.completeExceptionally(regionFailure);
      }
    });
    return result;
  }

  private void fail(
      TicketLockHandle handle,
      CompletableFuture<TicketLockHandle> acquired,
      Exception failure
  ) {
    abandon(handle, failure);
    acquired.completeExceptionally(failure);
  }

  private void abandon(TicketLockHandle handle, Exception failure) {
    try {
      handle.close();
    } catch (LockException releaseException) {
      if (failure == null) {
        LOG.log(
            Level.SEVERE,
            String.format("Lock{%s}: Could not hand back ticket '%d'",
                handle.getConversationId(), handle.getTicketNumber()),
            releaseException
        );
      } else {
        failure.addSuppressed(releaseException);
      }
    }
  }

  private static Throwable unwrap(Throwable failure) {
    if (failure instanceof CompletionException && failure.getCause() != null) {
      return failure.getCause();
    }
    return failure;
  }

  /**
   * Stop polling. Work still waiting for its turn fails with a {@link LockException} and its ticket
   * is handed back; work that already holds its lock is left to finish.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    for (Map.Entry<CompletableFuture<TicketLockHandle>, TicketLockHandle> entry
        : waiting.entrySet()) {
      final LockException closedException = closedWhileWaiting(entry.getValue());
      if (entry.getKey().completeExceptionally(closedException)) {
        abandon(entry.getValue(), closedException);
      }
    }
    waiting.clear();

    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  private static LockException closedWhileWaiting(TicketLockHandle handle) {
    return new LockException(
        handle.getConversationId(),
        String.format(
            "Locker was closed while ticket '%d' was waiting", handle.getTicketNumber()
        )
    );
  }

  private static final class PollerThreadFactory implements ThreadFactory {

    private final AtomicInteger threadNumber = new AtomicInteger(1);

    @Override
    public Thread newThread(Runnable runnable) {
      final Thread thread =
          new Thread(runnable, "turnstile-poller-" + threadNumber.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }
}
