package com.example.backoffice.model.returns;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.model.DomainRuleViolationException;
import com.example.backoffice.model.InvalidTransitionException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ReturnRequestTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Test
  void approvedRequestCompletesWithTrackingNumber() {
    final ReturnRequest request = newRequest();

    request.approve(NOW);
    request.complete("RT-1", NOW.plusSeconds(30));

    assertThat(request.status()).isEqualTo(ReturnRequestStatus.COMPLETED);
    assertThat(request.trackingNumber()).isEqualTo("RT-1");
    assertThat(request.completedAt()).isEqualTo(NOW.plusSeconds(30));
    assertThat(request.pendingEvents())
        .extracting(DomainEvent::eventType)
        .containsExactly(
            ReturnRequest.RETURN_REQUEST_CREATED,
            ReturnRequest.RETURN_REQUEST_APPROVED,
            ReturnRequest.RETURN_REQUEST_COMPLETED);
  }

  @Test
  void completeWithoutTrackingNumberIsRejected() {
    final ReturnRequest request = newRequest();
    request.approve(NOW);

    assertThatThrownBy(() -> request.complete(null, NOW))
        .isInstanceOf(DomainRuleViolationException.class)
        .hasMessageContaining("trackingNumber");
    assertThat(request.status()).isEqualTo(ReturnRequestStatus.APPROVED);
  }

  @Test
  void approvedRequestCannotBeDeleted() {
    final ReturnRequest request = newRequest();
    request.approve(NOW);

    assertThatThrownBy(() -> request.markAsDeleted(NOW))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void rejectedRequestCannotBeApproved() {
    final ReturnRequest request = newRequest();
    request.reject("outside return window", NOW);

    assertThat(request.rejectionReason()).isEqualTo("outside return window");
    assertThatThrownBy(() -> request.approve(NOW)).isInstanceOf(InvalidTransitionException.class);
  }

  private ReturnRequest newRequest() {
    return ReturnRequest.create(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        "wrong size",
        new BigDecimal("30.00"),
        NOW);
  }
}
