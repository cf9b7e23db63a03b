package com.wiligsi.turnstile.core.lock;

/**
 * Where a Ticket stands in its conversation's queue.
 *
 * @author Steven Miller
 */
public enum TicketStatus {
  SERVING,
  WAITING,
  EXPIRED
}
