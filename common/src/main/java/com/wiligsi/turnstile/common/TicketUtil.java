package com.wiligsi.turnstile.common;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;

import java.time.Duration;
import java.time.Instant;

/**
 * This is a utility class that has some shared methods around Tickets and conversation ids for
 * things like expiration checks and making dates easier to deal with.
 *
 * @author Steven Miller
 */
public class TicketUtil {

  private TicketUtil() {
  }

  /**
   * Create a new Ticket for a queue position.
   *
   * @param number     - the ticket number
   * @param expiration - the moment the ticket stops being valid
   * @return the new Ticket
   */
  public static Ticket newTicket(int number, Instant expiration) {
    return Ticket.newBuilder()
        .setNumber(number)
        .setExpiresAt(expiration.toEpochMilli())
        .build();
  }

  /**
   * Convert the expiration date from an int64 to a java Instant.
   *
   * @param ticket - the ticket to get the date from
   * @return the Instant representing the ticket's expiration date
   */
  public static Instant getExpirationInstant(Ticket ticket) {
    return Instant.ofEpochMilli(ticket.getExpiresAt());
  }

  /**
   * Check if a given ticket is expired given a current time. A ticket is expired from the moment
   * its expiration time is reached.
   *
   * @param ticket        - the ticket to check the expiration of
   * @param effectiveTime - the time to compare the ticket to
   * @return true if the ticket is expired and false if it is not expired
   */
  public static boolean isExpired(Ticket ticket, Instant effectiveTime) {
    return !effectiveTime.isBefore(getExpirationInstant(ticket));
  }

  /**
   * How long a ticket has left before it expires. Never negative.
   *
   * @param ticket        - the ticket to check
   * @param effectiveTime - the time to measure from
   * @return the remaining lifetime, or Duration.ZERO for an expired ticket
   */
  public static Duration remainingLifetime(Ticket ticket, Instant effectiveTime) {
    final Duration remaining = Duration.between(effectiveTime, getExpirationInstant(ticket));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /**
   * Rejects conversation ids that can't be used as a lock key.
   *
   * @param conversationId - the id to check
   * @return the same conversation id
   * @throws IllegalArgumentException if the id is null or blank
   */
  public static String requireValidConversationId(String conversationId) {
    if (conversationId == null || conversationId.isBlank()) {
      throw new IllegalArgumentException(
          String.format("Conversation id '%s' is invalid. Ids must not be blank", conversationId)
      );
    }
    return conversationId;
  }
}
