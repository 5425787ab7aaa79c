package com.example.backoffice.model.logistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.backoffice.model.AlreadyDeletedException;
import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.model.InvalidTransitionException;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class WarehouseTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Test
  void activeWarehouseMustBeDeactivatedBeforeDelete() {
    final Warehouse warehouse = Warehouse.create(UUID.randomUUID(), "TKY-1", "Tokyo", "Tokyo", 100, NOW);

    assertThatThrownBy(() -> warehouse.markAsDeleted(NOW))
        .isInstanceOf(InvalidTransitionException.class);

    warehouse.deactivate(NOW);
    warehouse.markAsDeleted(NOW);

    assertThat(warehouse.status()).isEqualTo(WarehouseStatus.DELETED);
    assertThat(warehouse.isDeleted()).isTrue();
    assertThat(warehouse.pendingEvents())
        .extracting(DomainEvent::eventType)
        .containsExactly(
            Warehouse.WAREHOUSE_CREATED,
            Warehouse.WAREHOUSE_DEACTIVATED,
            Warehouse.WAREHOUSE_DELETED);
    assertThatThrownBy(() -> warehouse.activate(NOW)).isInstanceOf(AlreadyDeletedException.class);
  }

  @Test
  void activateTwiceIsInvalid() {
    final Warehouse warehouse = Warehouse.create(UUID.randomUUID(), "OSK-1", "Osaka", null, 10, NOW);

    assertThatThrownBy(() -> warehouse.activate(NOW))
        .isInstanceOf(InvalidTransitionException.class)
        .hasMessageContaining("ACTIVE");
  }
}
