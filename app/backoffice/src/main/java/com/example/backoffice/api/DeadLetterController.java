/*
 * どこで: Backoffice 運用 API
 * 何を: dead-letter の一覧と再投入
 * なぜ: 配送を諦めた行を運用者が確認して戻せるようにするため
 */
package com.example.backoffice.api;

import com.example.backoffice.model.DeadLetterQuery;
import com.example.backoffice.service.DeadLetterService;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/outbox/dead-letters")
@RequiredArgsConstructor
public class DeadLetterController {

  private final DeadLetterService deadLetterService;

  @GetMapping
  public List<DeadLetterResponse> list(
      @RequestParam(value = "event_type", required = false) String eventType,
      @RequestParam(value = "from", required = false) Instant from,
      @RequestParam(value = "to", required = false) Instant to,
      @RequestParam(value = "error", required = false) String error,
      @RequestParam(value = "limit", defaultValue = "0") int limit) {
    return deadLetterService.find(new DeadLetterQuery(eventType, from, to, error, limit)).stream()
        .map(DeadLetterResponse::from)
        .toList();
  }

  @PostMapping("/{id}/replay")
  public DeadLetterResponse replay(@PathVariable("id") long id) {
    return DeadLetterResponse.from(deadLetterService.replay(id));
  }
}
