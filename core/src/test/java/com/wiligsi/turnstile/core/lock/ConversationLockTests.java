package com.wiligsi.turnstile.core.lock;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.ConversationLockData;
import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;
import static com.wiligsi.turnstile.core.assertion.TurnstileAssertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.protobuf.InvalidProtocolBufferException;
import com.wiligsi.turnstile.common.TicketUtil;
import com.wiligsi.turnstile.core.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

public class ConversationLockTests {

  private static final String CONVERSATION_ID = "conversation-42";
  private static final Duration LIFETIME = Duration.ofSeconds(60);

  private MutableClock clock;
  private ConversationLock lock;

  @BeforeEach
  public void setUp() {
    clock = new MutableClock(Instant.parse("2024-03-01T10:15:30.000Z"));
    lock = new ConversationLock(CONVERSATION_ID, clock);
  }

  @Test
  public void itShouldStartEmpty() {
    assertThat(lock)
        .hasLastIssued(ConversationLock.NO_TICKET_ISSUED)
        .hasNobodyWaiting();
    Assertions.assertThat(lock.getNowServing()).isEqualTo(0);
    Assertions.assertThat(lock.getTickets()).isEmpty();
  }

  @Test
  public void itShouldIssueConsecutiveNumbersStartingAtZero() {
    Assertions.assertThat(lock.issueTicket(LIFETIME)).isEqualTo(0);
    Assertions.assertThat(lock.issueTicket(LIFETIME)).isEqualTo(1);
    Assertions.assertThat(lock.issueTicket(LIFETIME)).isEqualTo(2);

    assertThat(lock)
        .hasLastIssued(2)
        .isServing(0)
        .hasWaiting(1, 2);
  }

  @Test
  public void itShouldStampTicketsWithTheirExpiration() {
    final Ticket ticket = lock.issue(LIFETIME);

    Assertions.assertThat(TicketUtil.getExpirationInstant(ticket))
        .isEqualTo(clock.instant().plus(LIFETIME));
  }

  @ParameterizedTest
  @MethodSource("provideUnusableLifetimes")
  public void itShouldRejectUnusableLifetimes(Duration lifetime) {
    assertThatThrownBy(() -> lock.issue(lifetime))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(lock).hasLastIssued(ConversationLock.NO_TICKET_ISSUED);
  }

  @Test
  public void itShouldServeTheNextTicketOnceTheHeadFinishes() {
    lock.issueTicket(LIFETIME);
    lock.issueTicket(LIFETIME);

    Assertions.assertThat(lock.finishServing(0)).isTrue();

    assertThat(lock).isServing(1);
  }

  @Test
  public void itShouldServeTheNextNumberWhenEverybodyFinished() {
    lock.issueTicket(LIFETIME);
    lock.finishServing(0);

    assertThat(lock).hasNobodyWaiting();
    Assertions.assertThat(lock.getNowServing()).isEqualTo(1);
  }

  @Test
  public void itShouldIgnoreFinishingATicketThatIsNotQueued() {
    lock.issueTicket(LIFETIME);

    Assertions.assertThat(lock.finishServing(7)).isFalse();
    assertThat(lock).isServing(0);
  }

  @Test
  public void itShouldLetALaterTicketFinishBeforeItIsServed() {
    lock.issueTicket(LIFETIME);
    lock.issueTicket(LIFETIME);
    lock.issueTicket(LIFETIME);

    lock.finishServing(1);

    assertThat(lock).isServing(0).hasWaiting(2);
    lock.finishServing(0);
    assertThat(lock).isServing(2);
  }

  @Test
  public void itShouldSkipAnExpiredHead() {
    lock.issueTicket(Duration.ofSeconds(5));
    lock.issueTicket(LIFETIME);

    clock.advance(Duration.ofSeconds(5));

    assertThat(lock).isServing(1);
    Assertions.assertThat(lock.statusOf(0)).isEqualTo(TicketStatus.EXPIRED);
    Assertions.assertThat(lock.ticketForNumber(0)).isEmpty();
  }

  @Test
  public void itShouldKeepATicketUntilTheInstantItExpires() {
    lock.issueTicket(Duration.ofSeconds(5));

    clock.advance(Duration.ofMillis(4999));
    assertThat(lock).isServing(0);

    clock.advance(Duration.ofMillis(1));
    assertThat(lock).hasNobodyWaiting();
  }

  @Test
  public void itShouldNotReuseNumbersAfterEveryTicketExpired() {
    lock.issueTicket(Duration.ofSeconds(1));
    clock.advance(Duration.ofSeconds(2));

    assertThat(lock).hasNobodyWaiting();
    Assertions.assertThat(lock.issueTicket(LIFETIME)).isEqualTo(1);
    assertThat(lock).isServing(1);
  }

  @Test
  public void itShouldOnlyRecognizeTheExactTicketIssued() {
    final Ticket issued = lock.issue(LIFETIME);
    final Ticket impostor = TicketUtil.newTicket(
        issued.getNumber(), TicketUtil.getExpirationInstant(issued).plusMillis(1)
    );

    Assertions.assertThat(lock.statusOf(issued)).isEqualTo(TicketStatus.SERVING);
    Assertions.assertThat(lock.statusOf(impostor)).isEqualTo(TicketStatus.EXPIRED);
    Assertions.assertThat(lock.finishServing(impostor)).isFalse();
    Assertions.assertThat(lock.finishServing(issued)).isTrue();
  }

  @Test
  public void itShouldRestoreFromItsSerializedState() throws InvalidProtocolBufferException {
    lock.issueTicket(LIFETIME);
    lock.issueTicket(LIFETIME);
    lock.issueTicket(LIFETIME);
    lock.finishServing(0);

    final ConversationLock restored = ConversationLock.parseFrom(lock.toByteArray(), clock);

    Assertions.assertThat(restored.getConversationId()).isEqualTo(CONVERSATION_ID);
    Assertions.assertThat(restored.getTickets()).isEqualTo(lock.getTickets());
    assertThat(restored).hasLastIssued(2).isServing(1).hasWaiting(2);
  }

  @Test
  public void itShouldServeTicketsInNumberOrderWhateverOrderTheyWereStored() {
    final Instant expiration = clock.instant().plus(LIFETIME);
    final ConversationLockData lockData = ConversationLockData.newBuilder()
        .setConversationId(CONVERSATION_ID)
        .addTickets(TicketUtil.newTicket(4, expiration))
        .addTickets(TicketUtil.newTicket(3, expiration))
        .setLastIssued(4)
        .build();

    assertThat(ConversationLock.fromLockData(lockData, clock)).isServing(3).hasWaiting(4);
  }

  @Test
  public void itShouldUseTheClockItIsGiven() {
    lock.issueTicket(Duration.ofSeconds(10));
    final MutableClock later = new MutableClock(clock.instant().plusSeconds(10));

    lock.setClock(later);

    assertThat(lock).hasNobodyWaiting();
  }

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "  "})
  public void itShouldRejectBlankConversationIds(String conversationId) {
    assertThatThrownBy(() -> new ConversationLock(conversationId, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Stream<Duration> provideUnusableLifetimes() {
    return Stream.of(null, Duration.ZERO, Duration.ofSeconds(-1));
  }
}
