package com.example.backoffice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.backoffice.model.DeadLetterQuery;
import com.example.backoffice.model.OutboxMessageRecord;
import com.example.backoffice.service.DeadLetterService;
import com.example.backoffice.service.DeadLetterStateException;
import com.example.backoffice.service.OutboxMessageNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DeadLetterController.class)
@Import(ApiExceptionHandler.class)
class DeadLetterControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DeadLetterService deadLetterService;

  @Test
  void listPassesFiltersAndRendersRows() throws Exception {
    when(deadLetterService.find(any(DeadLetterQuery.class)))
        .thenReturn(List.of(deadLettered(7L)));

    mockMvc
        .perform(
            get("/v1/outbox/dead-letters")
                .param("event_type", "OrderConfirmed")
                .param("from", "2026-03-01T00:00:00Z")
                .param("to", "2026-03-02T00:00:00Z")
                .param("error", "smtp")
                .param("limit", "20"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(7))
        .andExpect(jsonPath("$[0].event_type").value("OrderConfirmed"))
        .andExpect(jsonPath("$[0].retry_count").value(3))
        .andExpect(jsonPath("$[0].last_error").value("IllegalStateException: smtp down"));

    final ArgumentCaptor<DeadLetterQuery> query = ArgumentCaptor.forClass(DeadLetterQuery.class);
    verify(deadLetterService).find(query.capture());
    assertThat(query.getValue())
        .isEqualTo(
            new DeadLetterQuery(
                "OrderConfirmed",
                Instant.parse("2026-03-01T00:00:00Z"),
                Instant.parse("2026-03-02T00:00:00Z"),
                "smtp",
                20));
  }

  @Test
  void invalidRangeIsBadRequest() throws Exception {
    when(deadLetterService.find(any(DeadLetterQuery.class)))
        .thenThrow(new IllegalArgumentException("from must be before to"));

    mockMvc
        .perform(
            get("/v1/outbox/dead-letters")
                .param("from", "2026-03-02T00:00:00Z")
                .param("to", "2026-03-01T00:00:00Z"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("from must be before to"));
  }

  @Test
  void replayReturnsResetRow() throws Exception {
    final OutboxMessageRecord dead = deadLettered(7L);
    final OutboxMessageRecord reset =
        new OutboxMessageRecord(
            dead.id(),
            dead.eventId(),
            dead.aggregateId(),
            dead.aggregateType(),
            dead.eventType(),
            dead.payloadVersion(),
            dead.payloadJson(),
            dead.occurredAt(),
            null,
            0,
            null,
            null,
            null,
            NOW,
            null,
            dead.createdAt());
    when(deadLetterService.replay(7L)).thenReturn(reset);

    mockMvc
        .perform(post("/v1/outbox/dead-letters/{id}/replay", 7L))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.retry_count").value(0))
        .andExpect(jsonPath("$.dead_lettered_at").doesNotExist());
  }

  @Test
  void replayOfLiveRowIsConflict() throws Exception {
    when(deadLetterService.replay(8L))
        .thenThrow(new DeadLetterStateException("outbox message is not dead-lettered id=8"));

    mockMvc
        .perform(post("/v1/outbox/dead-letters/{id}/replay", 8L))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("NOT_DEAD_LETTERED"));
  }

  @Test
  void replayOfUnknownRowIsNotFound() throws Exception {
    when(deadLetterService.replay(9L)).thenThrow(new OutboxMessageNotFoundException(9L));

    mockMvc
        .perform(post("/v1/outbox/dead-letters/{id}/replay", 9L))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  private OutboxMessageRecord deadLettered(long id) {
    return new OutboxMessageRecord(
        id,
        UUID.randomUUID(),
        UUID.randomUUID(),
        "Order",
        "OrderConfirmed",
        1,
        "{}",
        NOW.minusSeconds(60),
        null,
        3,
        "IllegalStateException: smtp down",
        null,
        null,
        NOW,
        NOW,
        NOW.minusSeconds(60));
  }
}
