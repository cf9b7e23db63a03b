package com.wiligsi.turnstile.server;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.GetLockRequest;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.GetLockResponse;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.ListRequest;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.ListResponse;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.SwapLockRequest;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.SwapLockResponse;

import com.wiligsi.turnstile.common.TicketUtil;
import com.wiligsi.turnstile.common.TurnstileGrpc;
import com.wiligsi.turnstile.core.lock.ConversationLock;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.StreamObserver;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * This is the implementation of the Turnstile server itself that inherits from the Grpc stub
 * interface.
 *
 * <p>
 * The server keeps one serialized lock per conversation and only offers reads and whole-value
 * compare-and-swap writes. The ticket protocol runs in the workers; the server's job is to make
 * sure two workers can never both win a write against the same state. Locks whose tickets have
 * all expired are swept away periodically.
 * </p>
 *
 * @author Steven Miller
 */
public class LockStateServiceImpl extends TurnstileGrpc.TurnstileImplBase {

  private static final Logger LOG = Logger.getLogger(LockStateServiceImpl.class.getName());

  final ConcurrentMap<String, ConversationLockData> locks;
  private final Clock clock;

  public LockStateServiceImpl() {
    this(Clock.systemUTC());
  }

  public LockStateServiceImpl(Clock clock) {
    super();
    this.locks = new ConcurrentHashMap<>();
    this.clock = clock;
  }

  /**
   * Read the stored state of a conversation's lock.
   *
   * @param request          - the request containing the conversation id
   * @param responseObserver - the response stream used to respond to the client
   */
  @Override
  public void getLock(GetLockRequest request, StreamObserver<GetLockResponse> responseObserver) {
    try {
      final String conversationId = validConversationId(request.getConversationId());
      final ConversationLockData stored = locks.get(conversationId);

      final GetLockResponse.Builder response = GetLockResponse.newBuilder()
          .setFound(stored != null);
      if (stored != null) {
        response.setLock(stored);
      }
      responseObserver.onNext(response.build());
      responseObserver.onCompleted();
    } catch (StatusException statusException) {
      responseObserver.onError(statusException);
    }
  }

  /**
   * Replace a conversation's lock if it still holds the expected state. A lost race is reported
   * as an unsuccessful response, not as an error.
   *
   * @param request          - the conversation id with the expected and the updated state
   * @param responseObserver - the response stream used to respond to the client
   */
  @Override
  public void swapLock(SwapLockRequest request,
      StreamObserver<SwapLockResponse> responseObserver) {
    try {
      final String conversationId = validConversationId(request.getConversationId());
      if (request.hasUpdated()
          && !conversationId.equals(request.getUpdated().getConversationId())) {
        throw Status.INVALID_ARGUMENT
            .withDescription(
                String.format(
                    "Cannot store lock for '%s' under conversation '%s'",
                    request.getUpdated().getConversationId(), conversationId
                )
            )
            .asException();
      }

      final boolean success = swap(
          conversationId,
          request.hasExpected() ? request.getExpected() : null,
          request.hasUpdated() ? request.getUpdated() : null
      );
      if (!success) {
        LOG.fine(String.format("Lock{%s}: Swap rejected, state has changed", conversationId));
      }

      responseObserver.onNext(SwapLockResponse.newBuilder().setSuccess(success).build());
      responseObserver.onCompleted();
    } catch (StatusException statusException) {
      responseObserver.onError(statusException);
    }
  }

  /**
   * Get an alphabetical list of the conversations that have a stored lock.
   *
   * @param request          - a list lock request
   * @param responseObserver - the response stream used to respond to the client
   */
  @Override
  public void listLocks(ListRequest request, StreamObserver<ListResponse> responseObserver) {
    final List<String> conversationIds = locks.keySet().stream()
        .sorted()
        .collect(Collectors.toUnmodifiableList());

    responseObserver.onNext(
        ListResponse.newBuilder()
            .addAllConversationIds(conversationIds)
            .build()
    );
    responseObserver.onCompleted();
  }

  /**
   * Remove every lock that nobody is waiting on anymore. A lock that changes while it is being
   * checked is left alone.
   *
   * @return how many locks were removed
   */
  public int sweepExpired() {
    int removed = 0;
    for (Map.Entry<String, ConversationLockData> entry : locks.entrySet()) {
      final ConversationLock lock = ConversationLock.fromLockData(entry.getValue(), clock);
      if (!lock.isSomeoneWaiting() && locks.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }

    if (removed > 0) {
      LOG.info(String.format("Swept %d idle locks", removed));
    }
    return removed;
  }

  public int size() {
    return locks.size();
  }

  protected boolean swap(
      String conversationId,
      ConversationLockData expected,
      ConversationLockData updated
  ) {
    if (expected == null) {
      return updated == null
          ? !locks.containsKey(conversationId)
          : locks.putIfAbsent(conversationId, updated) == null;
    }
    if (updated == null) {
      return locks.remove(conversationId, expected);
    }
    return locks.replace(conversationId, expected, updated);
  }

  protected String validConversationId(String conversationId) throws StatusException {
    try {
      return TicketUtil.requireValidConversationId(conversationId);
    } catch (IllegalArgumentException argumentException) {
      throw asStatusException(Status.INVALID_ARGUMENT, argumentException);
    }
  }

  protected StatusException asStatusException(Status status, Throwable exception) {
    return status.withDescription(exception.getMessage())
        .withCause(exception)
        .asException();
  }
}
