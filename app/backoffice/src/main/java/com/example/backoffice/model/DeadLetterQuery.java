/*
 * どこで: Backoffice 運用 API
 * 何を: dead-letter 検索条件。null の条件は絞り込まない
 */
package com.example.backoffice.model;

import java.time.Instant;

public record DeadLetterQuery(
    String eventType, Instant from, Instant to, String errorContains, int limit) {}
