package com.wiligsi.turnstile.core;

/**
 * Thrown when a ticket expired before it was served. The holder never entered the protected
 * region and must not retry with the same ticket number.
 *
 * @author Steven Miller
 */
public class LockTimeoutException extends LockException {

  private final int ticketNumber;

  /**
   * Constructs a LockTimeoutException for the specified conversation and ticket.
   *
   * @param conversationId - the conversation the ticket was issued for
   * @param ticketNumber   - the ticket that expired while waiting
   */
  public LockTimeoutException(String conversationId, int ticketNumber) {
    super(
        conversationId,
        String.format(
            "Could not acquire lock for conversation '%s': ticket '%d' expired before it was served",
            conversationId,
            ticketNumber
        )
    );
    this.ticketNumber = ticketNumber;
  }

  public int getTicketNumber() {
    return ticketNumber;
  }
}
