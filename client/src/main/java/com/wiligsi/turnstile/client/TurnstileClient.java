package com.wiligsi.turnstile.client;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.GetLockRequest;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.GetLockResponse;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.ListRequest;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.SwapLockRequest;

import com.wiligsi.turnstile.common.TurnstileGrpc;
import io.grpc.Channel;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * This client takes the boilerplate out of interacting with the turnstile server by creating
 * methods that wrap the process of managing the requests/response with the server.
 *
 * @author Steven Miller
 */
public class TurnstileClient {

  static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(5);

  private static final Logger LOG = Logger.getLogger(TurnstileClient.class.getName());

  private final TurnstileGrpc.TurnstileBlockingStub turnstileBlockingStub;
  private final Duration deadline;

  /**
   * Create a new client instance given a channel for a turnstile server.
   *
   * @param channel - the channel the client uses to send requests
   */
  public TurnstileClient(Channel channel) {
    this(channel, DEFAULT_DEADLINE);
  }

  /**
   * Create a new client instance given a channel and a per-call deadline.
   *
   * @param channel  - the channel the client uses to send requests
   * @param deadline - how long a single call may take
   */
  public TurnstileClient(Channel channel, Duration deadline) {
    this.turnstileBlockingStub = TurnstileGrpc.newBlockingStub(channel);
    this.deadline = deadline;
  }

  /**
   * Read a conversation's stored lock.
   *
   * @param conversationId - the conversation to read
   * @return the stored state, or an empty optional if the server has no lock for it
   */
  public Optional<ConversationLockData> getLock(String conversationId) {
    final GetLockResponse response = stub().getLock(
        GetLockRequest.newBuilder()
            .setConversationId(conversationId)
            .build()
    );

    if (response.getFound()) {
      return Optional.of(response.getLock());
    } else {
      return Optional.empty();
    }
  }

  /**
   * Replace a conversation's stored lock if it still holds the expected state.
   *
   * @param conversationId - the conversation to write
   * @param expected       - the state that was read, or null if no lock was stored
   * @param updated        - the new state, or null to delete the lock
   * @return true if the server applied the swap
   */
  public boolean swapLock(
      String conversationId,
      ConversationLockData expected,
      ConversationLockData updated
  ) {
    final SwapLockRequest.Builder request = SwapLockRequest.newBuilder()
        .setConversationId(conversationId);
    if (expected != null) {
      request.setExpected(expected);
    }
    if (updated != null) {
      request.setUpdated(updated);
    }

    final boolean success = stub().swapLock(request.build()).getSuccess();
    if (!success) {
      LOG.fine(String.format("Lock{%s}: Server rejected swap", conversationId));
    }
    return success;
  }

  /**
   * List out the conversations that have a lock on the server.
   *
   * @return a list of conversation ids in alphabetical order
   */
  public List<String> listLocks() {
    ListRequest request = ListRequest.newBuilder().build();
    return stub().listLocks(request).getConversationIdsList();
  }

  private TurnstileGrpc.TurnstileBlockingStub stub() {
    return turnstileBlockingStub.withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
  }
}
