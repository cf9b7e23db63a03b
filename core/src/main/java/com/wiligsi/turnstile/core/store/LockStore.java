package com.wiligsi.turnstile.core.store;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;

import com.wiligsi.turnstile.core.LockException;
import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.WriteConflictException;
import com.wiligsi.turnstile.core.config.LockStoreConfig;
import com.wiligsi.turnstile.core.lock.ConversationLock;
import com.wiligsi.turnstile.core.lock.TicketStatus;
import java.time.Duration;
import java.util.Optional;

/**
 * This interface represents what turnstile expects a lock store to be able to do. A lock store
 * makes ConversationLock state visible to one or more workers and runs the ticket protocol on
 * top of it.
 *
 * @author Steven Miller
 */
public interface LockStore extends AutoCloseable {

  Optional<ConversationLock> getLock(String conversationId) throws StoreUnavailableException;

  ConversationLock createLock(String conversationId);

  void saveLock(ConversationLock lock) throws StoreUnavailableException, WriteConflictException;

  boolean deleteLock(String conversationId)
      throws StoreUnavailableException, WriteConflictException;

  int issueTicket(String conversationId) throws StoreUnavailableException, WriteConflictException;

  int issueTicket(String conversationId, Duration lockLifetime)
      throws StoreUnavailableException, WriteConflictException;

  void finishServing(String conversationId, int ticketNumber)
      throws StoreUnavailableException, WriteConflictException;

  boolean isSomeoneWaiting(String conversationId) throws StoreUnavailableException;

  TicketStatus getTicketStatus(String conversationId, Ticket ticket)
      throws StoreUnavailableException;

  TicketLockHandle enqueue(String conversationId, Duration lockLifetime)
      throws StoreUnavailableException, WriteConflictException;

  void release(String conversationId, Ticket ticket)
      throws StoreUnavailableException, WriteConflictException;

  TicketLockHandle lock(String conversationId) throws LockException, InterruptedException;

  TicketLockHandle lock(String conversationId, Duration waitTime, Duration lockLifetime)
      throws LockException, InterruptedException;

  boolean isSharedAcrossProcesses();

  LockStoreConfig getConfig();

  @Override
  default void close() {
  }
}
