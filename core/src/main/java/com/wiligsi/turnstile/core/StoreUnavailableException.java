package com.wiligsi.turnstile.core;

/**
 * Thrown when the backing store could not be read or written. An acquisition that fails this way
 * was not granted.
 *
 * @author Steven Miller
 */
public class StoreUnavailableException extends LockException {

  public StoreUnavailableException(String conversationId, Throwable cause) {
    super(
        conversationId,
        String.format(
            "Lock store is unavailable for conversation '%s': %s",
            conversationId,
            cause.getMessage()
        ),
        cause
    );
  }

  public StoreUnavailableException(String conversationId, String message) {
    super(conversationId, message);
  }
}
