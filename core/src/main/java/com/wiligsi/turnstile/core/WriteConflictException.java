package com.wiligsi.turnstile.core;

/**
 * Thrown when another actor changed a conversation's stored lock between this actor's read and
 * its write. Retrying from a fresh read is always safe.
 *
 * @author Steven Miller
 */
public class WriteConflictException extends LockException {

  /**
   * Constructs a WriteConflictException for the specified conversation.
   *
   * @param conversationId - the conversation whose lock was modified concurrently
   */
  public WriteConflictException(String conversationId) {
    super(
        conversationId,
        String.format(
            "Lock for conversation '%s' was modified by another writer", conversationId
        )
    );
  }
}
