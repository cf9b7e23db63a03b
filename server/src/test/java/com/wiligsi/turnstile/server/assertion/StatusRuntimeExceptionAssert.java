package com.wiligsi.turnstile.server.assertion;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.assertj.core.api.AbstractThrowableAssert;

public class StatusRuntimeExceptionAssert
    extends AbstractThrowableAssert<StatusRuntimeExceptionAssert, StatusRuntimeException> {

  public StatusRuntimeExceptionAssert(StatusRuntimeException actual) {
    super(actual, StatusRuntimeExceptionAssert.class);
  }

  public StatusRuntimeExceptionAssert isInvalidConversationIdException() {
    isInstanceOf(StatusRuntimeException.class);
    hasMessageContaining("Conversation id");
    hasFieldOrProperty("status");
    extracting("status")
        .hasFieldOrPropertyWithValue(
            "code",
            Status.INVALID_ARGUMENT.getCode()
        );

    return this;
  }

  public StatusRuntimeExceptionAssert isMismatchedLockException(String conversationId) {
    isInstanceOf(StatusRuntimeException.class);
    hasMessageContaining("Cannot store lock");
    hasMessageContaining(conversationId);
    extracting("status")
        .hasFieldOrPropertyWithValue(
            "code",
            Status.INVALID_ARGUMENT.getCode()
        );

    return this;
  }
}
