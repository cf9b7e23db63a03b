package com.wiligsi.turnstile.core.store;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;

import com.wiligsi.turnstile.common.TicketUtil;
import com.wiligsi.turnstile.core.LockException;
import com.wiligsi.turnstile.core.LockTimeoutException;
import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.lock.TicketStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * A Ticket held by one caller, together with the store that issued it. The handle is the scoped
 * resource of the lock protocol: it is created when the Ticket is issued, waits until the Ticket
 * is served and gives the Ticket back when closed.
 *
 * <pre>
 * try (TicketLockHandle handle = store.lock(conversationId)) {
 *   // only one holder per conversation gets here, in ticket order
 * }
 * </pre>
 *
 * <p>Closing is idempotent; the Ticket is handed back to the store exactly once.</p>
 *
 * @author Steven Miller
 */
public class TicketLockHandle implements AutoCloseable {

  private static final Logger LOG = Logger.getLogger(TicketLockHandle.class.getName());

  private static final Duration MIN_POLL_DELAY = Duration.ofMillis(1);

  private final LockStore store;
  private final String conversationId;
  private final Ticket ticket;
  private final Clock clock;
  private final AtomicBoolean released;

  TicketLockHandle(LockStore store, String conversationId, Ticket ticket, Clock clock) {
    this.store = store;
    this.conversationId = conversationId;
    this.ticket = ticket;
    this.clock = clock;
    this.released = new AtomicBoolean(false);
  }

  public String getConversationId() {
    return conversationId;
  }

  public Ticket getTicket() {
    return ticket;
  }

  public int getTicketNumber() {
    return ticket.getNumber();
  }

  public Instant getExpiration() {
    return TicketUtil.getExpirationInstant(ticket);
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * Ask the store where this handle's Ticket stands.
   *
   * @return SERVING, WAITING or EXPIRED
   * @throws StoreUnavailableException if the store can't be read
   */
  public TicketStatus status() throws StoreUnavailableException {
    return store.getTicketStatus(conversationId, ticket);
  }

  /**
   * Block until the Ticket is served. The queue is checked every {@code waitTime}, and never later
   * than the Ticket's expiration.
   *
   * @param waitTime - the poll interval
   * @throws LockTimeoutException      if the Ticket expired before it was served
   * @throws StoreUnavailableException if the store can't be read
   * @throws InterruptedException      if the waiting thread is interrupted
   */
  public void awaitServed(Duration waitTime)
      throws LockTimeoutException, StoreUnavailableException, InterruptedException {
    while (true) {
      final TicketStatus status = status();
      if (status == TicketStatus.SERVING) {
        LOG.fine(
            String.format(
                "Lock{%s}: Acquired with ticket '%d'", conversationId, ticket.getNumber()
            )
        );
        return;
      }

      if (status == TicketStatus.EXPIRED || isExpired()) {
        LOG.warning(
            String.format(
                "Lock{%s}: Ticket '%d' expired while waiting", conversationId, ticket.getNumber()
            )
        );
        throw new LockTimeoutException(conversationId, ticket.getNumber());
      }

      Thread.sleep(nextPollDelay(waitTime).toMillis());
    }
  }

  /**
   * How long to wait before the next check: the poll interval, cut short by the expiration.
   *
   * @param waitTime - the poll interval
   * @return the delay before the next check
   */
  public Duration nextPollDelay(Duration waitTime) {
    final Duration remaining = TicketUtil.remainingLifetime(ticket, Instant.now(clock));
    final Duration delay = waitTime.compareTo(remaining) < 0 ? waitTime : remaining;
    return delay.compareTo(MIN_POLL_DELAY) < 0 ? MIN_POLL_DELAY : delay;
  }

  /**
   * Whether the Ticket's lease has run out according to this handle's clock.
   *
   * @return true once the expiration is reached
   */
  public boolean isExpired() {
    return TicketUtil.isExpired(ticket, Instant.now(clock));
  }

  /**
   * Give the Ticket back so the next one in line can be served.
   *
   * @throws LockException if the store could not record the release
   */
  @Override
  public void close() throws LockException {
    if (released.compareAndSet(false, true)) {
      store.release(conversationId, ticket);
      LOG.fine(
          String.format(
              "Lock{%s}: Released ticket '%d'", conversationId, ticket.getNumber()
          )
      );
    }
  }

  @Override
  public String toString() {
    return String.format(
        "TicketLockHandle{conversationId='%s', ticket=%d, expiration=%s, released=%s}",
        conversationId, ticket.getNumber(), getExpiration(), released.get()
    );
  }
}
