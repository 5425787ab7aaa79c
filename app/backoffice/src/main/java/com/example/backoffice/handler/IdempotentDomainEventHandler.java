/*
 * どこで: Backoffice イベント配送
 * 何を: (event_id, handler 名) で重複を弾き、副作用と同じトランザクションで記録する handler 基底
 * なぜ: クラッシュ後の再配送で同じイベントを二重に反映しないため
 */
package com.example.backoffice.handler;

import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

public abstract class IdempotentDomainEventHandler implements DomainEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(IdempotentDomainEventHandler.class);

  private final ProcessedEventRepository processedEventRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  protected IdempotentDomainEventHandler(
      ProcessedEventRepository processedEventRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.processedEventRepository = processedEventRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  @Override
  public final void handle(DomainEvent event) throws Exception {
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            final boolean first =
                processedEventRepository.insertIfAbsent(event.eventId(), name(), Instant.now(clock));
            if (!first) {
              logger.info(
                  "event already handled; skipping handler={} eventId={} eventType={}",
                  name(),
                  event.eventId(),
                  event.eventType());
              return;
            }
            try {
              handleOnce(event);
            } catch (RuntimeException ex) {
              throw ex;
            } catch (Exception ex) {
              throw new CheckedHandlerFailure(ex);
            }
          });
    } catch (CheckedHandlerFailure ex) {
      throw (Exception) ex.getCause();
    }
  }

  /** processed_events と同じトランザクション内で一度だけ呼ばれる。 */
  protected abstract void handleOnce(DomainEvent event) throws Exception;

  // TransactionCallback から検査例外を運び出すための入れ物
  private static final class CheckedHandlerFailure extends RuntimeException {
    private CheckedHandlerFailure(Exception cause) {
      super(cause);
    }
  }
}
