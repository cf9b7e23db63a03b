package com.wiligsi.turnstile.core;

/**
 * Base class for failures of the conversation lock protocol. None of these are fatal; the caller
 * that wanted the lock decides whether to retry or report the failure.
 *
 * @author Steven Miller
 */
public class LockException extends Exception {

  private final String conversationId;

  public LockException(String conversationId, String message) {
    super(message);
    this.conversationId = conversationId;
  }

  public LockException(String conversationId, String message, Throwable cause) {
    super(message, cause);
    this.conversationId = conversationId;
  }

  /**
   * Returns the conversation the failed lock operation was for.
   *
   * @return the conversation id
   */
  public String getConversationId() {
    return conversationId;
  }
}
