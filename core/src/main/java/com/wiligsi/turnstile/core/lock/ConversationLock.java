package com.wiligsi.turnstile.core.lock;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;

import com.google.protobuf.InvalidProtocolBufferException;
import com.wiligsi.turnstile.common.TicketUtil;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The per-conversation ticket queue. A ConversationLock hands out numbered Tickets and decides
 * which one is allowed into the critical section.
 *
 * <p>Tickets are issued with consecutive numbers starting at 0 and are served strictly in that
 * order. Every read of the queue first removes expired Tickets, so a holder that crashed or hung
 * only blocks the conversation until its Ticket's lease runs out. The Ticket being served is the
 * lowest remaining number; when nobody is waiting it is the number the next Ticket will get.</p>
 *
 * <p>A ConversationLock is a local working copy. Stores hand out copies, callers change them and
 * the result has to be written back through the store to become visible. The state serializes to
 * a {@link ConversationLockData} protocol buffer.</p>
 *
 * @author Steven Miller
 */
public class ConversationLock {

  public static final int NO_TICKET_ISSUED = -1;

  private static final Logger LOG = Logger.getLogger(ConversationLock.class.getName());

  private final String conversationId;
  private final List<Ticket> tickets;
  private int lastIssued;

  private Clock clock;

  /**
   * Construct a new empty lock for a conversation.
   *
   * @param conversationId - the conversation this lock guards
   * @param clock          - the clock used to issue and expire Tickets
   * @throws IllegalArgumentException if the conversation id is blank
   */
  public ConversationLock(String conversationId, Clock clock) {
    this.conversationId = TicketUtil.requireValidConversationId(conversationId);
    this.clock = clock;
    this.tickets = new ArrayList<>();
    this.lastIssued = NO_TICKET_ISSUED;
  }

  /**
   * Construct a new empty lock for a conversation using the system clock.
   *
   * @param conversationId - the conversation this lock guards
   */
  public ConversationLock(String conversationId) {
    this(conversationId, Clock.systemUTC());
  }

  private ConversationLock(ConversationLockData lockData, Clock clock) {
    this(lockData.getConversationId(), clock);
    tickets.addAll(lockData.getTicketsList());
    tickets.sort(Comparator.comparingInt(Ticket::getNumber));
    lastIssued = lockData.getLastIssued();
  }

  /**
   * Restore a lock from its serialized state.
   *
   * @param lockData - the stored state
   * @param clock    - the clock the restored lock should use
   * @return a working copy of the stored lock
   */
  public static ConversationLock fromLockData(ConversationLockData lockData, Clock clock) {
    return new ConversationLock(lockData, clock);
  }

  /**
   * Restore a lock from serialized bytes.
   *
   * @param bytes - the output of {@link #toByteArray()}
   * @param clock - the clock the restored lock should use
   * @return a working copy of the stored lock
   * @throws InvalidProtocolBufferException if the bytes are not a serialized lock
   */
  public static ConversationLock parseFrom(byte[] bytes, Clock clock)
      throws InvalidProtocolBufferException {
    return fromLockData(ConversationLockData.parseFrom(bytes), clock);
  }

  /**
   * Adds a new Ticket to the end of the queue.
   *
   * @param lifetime - how long the Ticket stays valid
   * @return the new Ticket
   * @throws IllegalArgumentException if the lifetime is not positive
   */
  public Ticket issue(Duration lifetime) {
    if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
      throw new IllegalArgumentException(
          String.format("Ticket lifetime must be positive but was '%s'", lifetime)
      );
    }

    final int number = lastIssued + 1;
    final Ticket ticket = TicketUtil.newTicket(number, Instant.now(clock).plus(lifetime));
    tickets.add(ticket);
    lastIssued = number;

    LOG.fine(
        String.format(
            "Lock{%s}: Issued ticket '%d' expiring at %s",
            conversationId,
            number,
            TicketUtil.getExpirationInstant(ticket)
        )
    );
    return ticket;
  }

  /**
   * Adds a new Ticket to the end of the queue and returns its number.
   *
   * @param lifetime - how long the Ticket stays valid
   * @return the number of the new Ticket
   */
  public int issueTicket(Duration lifetime) {
    return issue(lifetime).getNumber();
  }

  /**
   * Removes every Ticket whose lease has elapsed.
   */
  public void removeExpiredTickets() {
    final Instant effectiveTime = Instant.now(clock);
    tickets.removeIf(ticket -> {
      final boolean expired = TicketUtil.isExpired(ticket, effectiveTime);
      if (expired) {
        LOG.fine(
            String.format(
                "Lock{%s}: Removed expired ticket '%d'", conversationId, ticket.getNumber()
            )
        );
      }
      return expired;
    });
  }

  /**
   * Looks up a Ticket by number after removing expired Tickets.
   *
   * @param number - the ticket number to look for
   * @return the Ticket, or an empty optional if it was never issued or has expired
   */
  public Optional<Ticket> ticketForNumber(int number) {
    removeExpiredTickets();
    return tickets.stream()
        .filter(ticket -> ticket.getNumber() == number)
        .findFirst();
  }

  /**
   * Returns the number that is currently allowed into the critical section.
   *
   * @return the lowest live ticket number, or the next number to be issued if nobody is waiting
   */
  public int getNowServing() {
    removeExpiredTickets();
    if (tickets.isEmpty()) {
      return lastIssued + 1;
    }
    return tickets.get(0).getNumber();
  }

  /**
   * Decide whether a Ticket may enter the critical section. Only the exact Ticket that was issued
   * counts; a Ticket with the same number but a different expiration belongs to somebody else.
   *
   * @param ticket - the Ticket held by the caller
   * @return SERVING, WAITING or EXPIRED
   */
  public TicketStatus statusOf(Ticket ticket) {
    removeExpiredTickets();
    if (!tickets.contains(ticket)) {
      return TicketStatus.EXPIRED;
    }
    return getNowServing() == ticket.getNumber() ? TicketStatus.SERVING : TicketStatus.WAITING;
  }

  /**
   * Decide whether the Ticket with a given number may enter the critical section.
   *
   * @param number - the ticket number
   * @return SERVING, WAITING or EXPIRED
   */
  public TicketStatus statusOf(int number) {
    final Optional<Ticket> ticket = ticketForNumber(number);
    return ticket.map(this::statusOf).orElse(TicketStatus.EXPIRED);
  }

  /**
   * Removes a served Ticket so the next one in line can be served.
   *
   * @param number - the number of the Ticket that is done
   * @return true if a Ticket was removed
   */
  public boolean finishServing(int number) {
    final boolean removed = tickets.removeIf(ticket -> ticket.getNumber() == number);
    logFinished(number, removed);
    return removed;
  }

  /**
   * Removes exactly this Ticket from the queue.
   *
   * @param ticket - the Ticket that is done
   * @return true if the Ticket was still queued
   */
  public boolean finishServing(Ticket ticket) {
    final boolean removed = tickets.remove(ticket);
    logFinished(ticket.getNumber(), removed);
    return removed;
  }

  /**
   * Returns whether any live Ticket is queued.
   *
   * @return true if somebody is waiting or being served
   */
  public boolean isSomeoneWaiting() {
    removeExpiredTickets();
    return !tickets.isEmpty();
  }

  public String getConversationId() {
    return conversationId;
  }

  public int getLastIssued() {
    return lastIssued;
  }

  /**
   * Returns the queued Tickets in serving order, including any that expired since the last read.
   *
   * @return an unmodifiable copy of the queue
   */
  public List<Ticket> getTickets() {
    return Collections.unmodifiableList(new ArrayList<>(tickets));
  }

  /**
   * Serialize the lock's state.
   *
   * @return the protocol buffer form of this lock
   */
  public ConversationLockData toLockData() {
    return ConversationLockData.newBuilder()
        .setConversationId(conversationId)
        .addAllTickets(tickets)
        .setLastIssued(lastIssued)
        .build();
  }

  public byte[] toByteArray() {
    return toLockData().toByteArray();
  }

  protected void setClock(Clock clock) {
    this.clock = clock;
  }

  private void logFinished(int number, boolean removed) {
    if (removed) {
      LOG.fine(
          String.format("Lock{%s}: Finished serving ticket '%d'", conversationId, number)
      );
    } else {
      LOG.fine(
          String.format(
              "Lock{%s}: Ticket '%d' was not queued when finishing", conversationId, number
          )
      );
    }
  }

  @Override
  public String toString() {
    return String.format(
        "ConversationLock{conversationId='%s', tickets=%s, lastIssued=%d}",
        conversationId, tickets, lastIssued
    );
  }
}
