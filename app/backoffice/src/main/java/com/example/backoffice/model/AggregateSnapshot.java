/*
 * どこで: Backoffice 集約ストア
 * 何を: aggregate_snapshots の 1 行 (JSON 状態と楽観ロック用バージョン)
 */
package com.example.backoffice.model;

import java.time.Instant;
import java.util.UUID;

public record AggregateSnapshot(
    String aggregateType,
    UUID aggregateId,
    String status,
    boolean deleted,
    long version,
    String stateJson,
    Instant createdAt,
    Instant updatedAt) {}
