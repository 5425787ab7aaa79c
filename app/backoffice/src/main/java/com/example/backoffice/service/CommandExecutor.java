/*
 * どこで: Backoffice サービス層
 * 何を: 読み込み -> 変更 -> saveChanges を一単位で実行し、競合時は最初からやり直す
 * なぜ: メモリ上の状態が古い可能性があるため、保存だけの再実行をさせないため
 */
package com.example.backoffice.service;

import com.example.backoffice.config.CommandProperties;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CommandExecutor {

  private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

  private final UnitOfWorkFactory unitOfWorkFactory;
  private final CommandProperties properties;

  /**
   * {@code command} は渡された UnitOfWork で集約を読み込み/登録し、変更するだけにする。
   * 保存はここで行う。競合のたびに新しい UnitOfWork で {@code command} を呼び直す。
   */
  public <T> T execute(String commandName, Function<UnitOfWork, T> command) {
    int attempt = 0;
    while (true) {
      attempt++;
      final UnitOfWork unitOfWork = unitOfWorkFactory.begin();
      try {
        final T result = command.apply(unitOfWork);
        unitOfWork.saveChanges();
        return result;
      } catch (PersistenceConflictException ex) {
        if (attempt > properties.maxConflictRetries()) {
          logger.warn(
              "command conflict retries exhausted command={} attempts={}", commandName, attempt, ex);
          throw ex;
        }
        logger.warn(
            "command conflict; retrying from load command={} attempt={} reason={}",
            commandName,
            attempt,
            ex.getMessage());
      }
    }
  }
}
