package com.wiligsi.turnstile.common;

import static com.wiligsi.turnstile.common.TurnstileOuterClass.Ticket;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TicketUtilTests {

  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.000Z");

  @Test
  public void itShouldNotBeExpiredBeforeItsExpiration() {
    final Ticket ticket = TicketUtil.newTicket(0, NOW.plusMillis(1));

    assertThat(TicketUtil.isExpired(ticket, NOW)).isFalse();
  }

  @Test
  public void itShouldBeExpiredAtItsExpiration() {
    final Ticket ticket = TicketUtil.newTicket(0, NOW);

    assertThat(TicketUtil.isExpired(ticket, NOW)).isTrue();
    assertThat(TicketUtil.isExpired(ticket, NOW.plusSeconds(1))).isTrue();
  }

  @Test
  public void itShouldReportRemainingLifetime() {
    final Ticket ticket = TicketUtil.newTicket(3, NOW.plusSeconds(10));

    assertThat(TicketUtil.remainingLifetime(ticket, NOW)).isEqualTo(Duration.ofSeconds(10));
    assertThat(TicketUtil.remainingLifetime(ticket, NOW.plusSeconds(30))).isEqualTo(Duration.ZERO);
  }

  @Test
  public void itShouldKeepTheExpirationInstant() {
    final Ticket ticket = TicketUtil.newTicket(7, NOW);

    assertThat(ticket.getNumber()).isEqualTo(7);
    assertThat(TicketUtil.getExpirationInstant(ticket)).isEqualTo(NOW);
  }

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "   "})
  public void itShouldRejectBlankConversationIds(String conversationId) {
    assertThatThrownBy(
        () -> TicketUtil.requireValidConversationId(conversationId)
    ).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void itShouldAcceptConversationIdsWithSpaces() {
    assertThat(TicketUtil.requireValidConversationId("my id 0")).isEqualTo("my id 0");
  }
}
