package com.wiligsi.turnstile.core.store;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;

import com.wiligsi.turnstile.common.TicketUtil;
import com.wiligsi.turnstile.core.LockException;
import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.WriteConflictException;
import com.wiligsi.turnstile.core.config.LockStoreConfig;
import com.wiligsi.turnstile.core.lock.ConversationLock;
import com.wiligsi.turnstile.core.lock.TicketStatus;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * The ticket protocol, written once against two storage primitives: an atomic read and an atomic
 * compare-and-swap. Backends only have to supply those two; everything that changes a stored lock
 * goes through read, change a local copy, then swap only if the stored state is still the state
 * that was read.
 *
 * <p>A failed swap means somebody else changed the lock in between. Issuing a ticket reports that
 * as a {@link WriteConflictException} so numbering stays gap-free and unique. Finishing and
 * releasing a ticket simply try again from a fresh read, since removing one's own ticket can be
 * repeated safely.</p>
 *
 * @author Steven Miller
 */
public abstract class AbstractLockStore implements LockStore {

  private static final Logger LOG = Logger.getLogger(AbstractLockStore.class.getName());

  protected final LockStoreConfig config;

  protected AbstractLockStore(LockStoreConfig config) {
    this.config = config;
  }

  /**
   * Read the stored state of a conversation's lock.
   *
   * @param conversationId - the conversation to read
   * @return the stored state, or an empty optional if no lock is stored
   * @throws StoreUnavailableException if the backend can't be read
   */
  protected abstract Optional<ConversationLockData> readLockData(String conversationId)
      throws StoreUnavailableException;

  /**
   * Atomically replace a conversation's stored state if it still equals {@code expected}.
   *
   * @param conversationId - the conversation to write
   * @param expected       - the state that was read, or null for "no lock stored"
   * @param updated        - the new state, or null to delete the lock
   * @return true if the swap happened, false if the stored state had changed
   * @throws StoreUnavailableException if the backend can't be written
   */
  protected abstract boolean compareAndSwapLockData(
      String conversationId,
      ConversationLockData expected,
      ConversationLockData updated
  ) throws StoreUnavailableException;

  @Override
  public Optional<ConversationLock> getLock(String conversationId)
      throws StoreUnavailableException {
    TicketUtil.requireValidConversationId(conversationId);
    return readLockData(conversationId)
        .map(lockData -> ConversationLock.fromLockData(lockData, config.getClock()));
  }

  @Override
  public ConversationLock createLock(String conversationId) {
    return new ConversationLock(conversationId, config.getClock());
  }

  @Override
  public void saveLock(ConversationLock lock)
      throws StoreUnavailableException, WriteConflictException {
    final String conversationId = lock.getConversationId();
    final ConversationLockData updated = lock.toLockData();
    for (int attempt = 1; attempt <= config.getMaxWriteAttempts(); attempt++) {
      final Optional<ConversationLockData> current = readLockData(conversationId);
      if (compareAndSwapLockData(conversationId, current.orElse(null), updated)) {
        return;
      }
    }
    throw conflict(conversationId, "saving");
  }

  @Override
  public boolean deleteLock(String conversationId)
      throws StoreUnavailableException, WriteConflictException {
    TicketUtil.requireValidConversationId(conversationId);
    for (int attempt = 1; attempt <= config.getMaxWriteAttempts(); attempt++) {
      final Optional<ConversationLockData> current = readLockData(conversationId);
      if (current.isEmpty()) {
        return false;
      }

      final ConversationLock lock = ConversationLock.fromLockData(current.get(), config.getClock());
      if (lock.isSomeoneWaiting()) {
        LOG.fine(
            String.format("Lock{%s}: Not deleted, tickets are still queued", conversationId)
        );
        return false;
      }

      if (compareAndSwapLockData(conversationId, current.get(), null)) {
        LOG.fine(String.format("Lock{%s}: Deleted", conversationId));
        return true;
      }
    }
    throw conflict(conversationId, "deleting");
  }

  @Override
  public int issueTicket(String conversationId)
      throws StoreUnavailableException, WriteConflictException {
    return issueTicket(conversationId, config.getLockLifetime());
  }

  @Override
  public int issueTicket(String conversationId, Duration lockLifetime)
      throws StoreUnavailableException, WriteConflictException {
    return issue(conversationId, lockLifetime).getNumber();
  }

  @Override
  public void finishServing(String conversationId, int ticketNumber)
      throws StoreUnavailableException, WriteConflictException {
    update(conversationId, lock -> lock.finishServing(ticketNumber), false);
  }

  @Override
  public boolean isSomeoneWaiting(String conversationId) throws StoreUnavailableException {
    return getLock(conversationId).map(ConversationLock::isSomeoneWaiting).orElse(false);
  }

  @Override
  public TicketStatus getTicketStatus(String conversationId, Ticket ticket)
      throws StoreUnavailableException {
    return getLock(conversationId)
        .map(lock -> lock.statusOf(ticket))
        .orElse(TicketStatus.EXPIRED);
  }

  @Override
  public TicketLockHandle enqueue(String conversationId, Duration lockLifetime)
      throws StoreUnavailableException, WriteConflictException {
    WriteConflictException lastConflict = null;
    for (int attempt = 1; attempt <= config.getMaxWriteAttempts(); attempt++) {
      try {
        final Ticket ticket = issue(conversationId, lockLifetime);
        return new TicketLockHandle(this, conversationId, ticket, config.getClock());
      } catch (WriteConflictException conflictException) {
        lastConflict = conflictException;
      }
    }
    throw lastConflict;
  }

  /**
   * Hand a ticket back. The ticket is removed from the queue and, when nobody else is queued, the
   * stored lock is removed in the same swap so the store doesn't grow without bound.
   *
   * @param conversationId - the conversation the ticket belongs to
   * @param ticket         - the exact ticket that was issued
   */
  @Override
  public void release(String conversationId, Ticket ticket)
      throws StoreUnavailableException, WriteConflictException {
    update(conversationId, lock -> lock.finishServing(ticket), true);
  }

  @Override
  public TicketLockHandle lock(String conversationId) throws LockException, InterruptedException {
    return lock(conversationId, config.getWaitTime(), config.getLockLifetime());
  }

  /**
   * Issue a ticket and wait until it is served. The returned handle must be closed when the
   * protected work is done. If waiting fails the ticket is handed back before the failure is
   * rethrown, so it never holds up the tickets behind it.
   *
   * @param conversationId - the conversation to lock
   * @param waitTime       - how long to sleep between checks of the queue
   * @param lockLifetime   - how long the ticket stays valid
   * @return a handle holding the served ticket
   * @throws LockException        if the ticket expired first or the store failed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  @Override
  public TicketLockHandle lock(String conversationId, Duration waitTime, Duration lockLifetime)
      throws LockException, InterruptedException {
    final TicketLockHandle handle = enqueue(conversationId, lockLifetime);
    try {
      handle.awaitServed(waitTime);
      return handle;
    } catch (LockException | InterruptedException | RuntimeException failure) {
      abandon(handle, failure);
      throw failure;
    }
  }

  @Override
  public LockStoreConfig getConfig() {
    return config;
  }

  protected Ticket issue(String conversationId, Duration lockLifetime)
      throws StoreUnavailableException, WriteConflictException {
    TicketUtil.requireValidConversationId(conversationId);
    final Optional<ConversationLockData> current = readLockData(conversationId);
    final ConversationLock lock = current
        .map(lockData -> ConversationLock.fromLockData(lockData, config.getClock()))
        .orElseGet(() -> createLock(conversationId));

    final Ticket ticket = lock.issue(lockLifetime);
    if (!compareAndSwapLockData(conversationId, current.orElse(null), lock.toLockData())) {
      LOG.warning(
          String.format(
              "Lock{%s}: Ticket '%d' collided with a ticket issued by another writer",
              conversationId,
              ticket.getNumber()
          )
      );
      throw new WriteConflictException(conversationId);
    }

    LOG.fine(
        String.format("Lock{%s}: Issued ticket '%d'", conversationId, ticket.getNumber())
    );
    return ticket;
  }

  private void update(
      String conversationId,
      Consumer<ConversationLock> change,
      boolean deleteWhenIdle
  ) throws StoreUnavailableException, WriteConflictException {
    TicketUtil.requireValidConversationId(conversationId);
    for (int attempt = 1; attempt <= config.getMaxWriteAttempts(); attempt++) {
      final Optional<ConversationLockData> current = readLockData(conversationId);
      if (current.isEmpty()) {
        LOG.fine(String.format("Lock{%s}: No lock stored, nothing to finish", conversationId));
        return;
      }

      final ConversationLock lock = ConversationLock.fromLockData(current.get(), config.getClock());
      change.accept(lock);
      final ConversationLockData updated =
          deleteWhenIdle && !lock.isSomeoneWaiting() ? null : lock.toLockData();

      if (compareAndSwapLockData(conversationId, current.get(), updated)) {
        if (updated == null) {
          LOG.fine(String.format("Lock{%s}: Nobody waiting, lock removed", conversationId));
        }
        return;
      }
    }
    throw conflict(conversationId, "updating");
  }

  private WriteConflictException conflict(String conversationId, String action) {
    LOG.warning(
        String.format(
            "Lock{%s}: Gave up %s after %d conflicting writes",
            conversationId, action, config.getMaxWriteAttempts()
        )
    );
    return new WriteConflictException(conversationId);
  }

  private void abandon(TicketLockHandle handle, Exception failure) {
    try {
      handle.close();
    } catch (LockException releaseException) {
      failure.addSuppressed(releaseException);
    }
  }
}
