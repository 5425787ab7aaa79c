/*
 * どこで: 定期購読集約
 * 何を: 試用 -> 有効 -> 停止/解約/期限切れ と更新を管理する
 * なぜ: 期限前の期限切れ処理や解約済み購読の更新を防ぐため
 */
package com.example.backoffice.model.subscription;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.DomainRuleViolationException;
import com.example.backoffice.model.TransitionTable;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class Subscription extends AggregateRoot<SubscriptionStatus, SubscriptionOperation> {

  public static final String SUBSCRIPTION_CREATED = "SubscriptionCreated";
  public static final String SUBSCRIPTION_ACTIVATED = "SubscriptionActivated";
  public static final String SUBSCRIPTION_SUSPENDED = "SubscriptionSuspended";
  public static final String SUBSCRIPTION_CANCELLED = "SubscriptionCancelled";
  public static final String SUBSCRIPTION_EXPIRED = "SubscriptionExpired";
  public static final String SUBSCRIPTION_RENEWED = "SubscriptionRenewed";
  public static final String SUBSCRIPTION_DELETED = "SubscriptionDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(
          SUBSCRIPTION_CREATED,
          SUBSCRIPTION_ACTIVATED,
          SUBSCRIPTION_SUSPENDED,
          SUBSCRIPTION_CANCELLED,
          SUBSCRIPTION_EXPIRED,
          SUBSCRIPTION_RENEWED,
          SUBSCRIPTION_DELETED);

  static final TransitionTable<SubscriptionStatus, SubscriptionOperation> TRANSITIONS =
      TransitionTable.builder("Subscription", SubscriptionStatus.class, SubscriptionOperation.class)
          .permitFrom(
              SubscriptionOperation.ACTIVATE,
              SubscriptionStatus.ACTIVE,
              SubscriptionStatus.TRIAL,
              SubscriptionStatus.SUSPENDED)
          .permit(
              SubscriptionStatus.ACTIVE, SubscriptionOperation.SUSPEND, SubscriptionStatus.SUSPENDED)
          .permitFrom(
              SubscriptionOperation.CANCEL,
              SubscriptionStatus.CANCELLED,
              SubscriptionStatus.TRIAL,
              SubscriptionStatus.ACTIVE,
              SubscriptionStatus.SUSPENDED)
          .permitFrom(
              SubscriptionOperation.EXPIRE,
              SubscriptionStatus.EXPIRED,
              SubscriptionStatus.TRIAL,
              SubscriptionStatus.ACTIVE)
          .permit(SubscriptionStatus.ACTIVE, SubscriptionOperation.RENEW, SubscriptionStatus.ACTIVE)
          .permitFrom(
              SubscriptionOperation.DELETE,
              SubscriptionStatus.DELETED,
              SubscriptionStatus.CANCELLED,
              SubscriptionStatus.EXPIRED)
          .deletedState(SubscriptionStatus.DELETED)
          .build();

  private UUID userId;
  private UUID planId;
  private Instant startDate;
  private Instant trialEndDate;
  private Instant endDate;
  private boolean autoRenew;
  private int renewalCount;
  private String cancellationReason;
  private Instant cancelledAt;

  private Subscription() {}

  /** 試用日数が 0 の場合は ACTIVE で開始する。 */
  public static Subscription create(
      UUID id,
      UUID userId,
      UUID planId,
      Duration trialPeriod,
      Duration billingPeriod,
      boolean autoRenew,
      Instant at) {
    final Subscription subscription = new Subscription();
    subscription.userId = requirePresent(userId, "userId");
    subscription.planId = requirePresent(planId, "planId");
    requirePositivePeriod(billingPeriod, "billingPeriod");
    final boolean trial = trialPeriod != null && !trialPeriod.isZero() && !trialPeriod.isNegative();
    subscription.startDate = at;
    subscription.trialEndDate = trial ? at.plus(trialPeriod) : null;
    subscription.endDate =
        trial ? subscription.trialEndDate.plus(billingPeriod) : at.plus(billingPeriod);
    subscription.autoRenew = autoRenew;
    final SubscriptionStatus initial = trial ? SubscriptionStatus.TRIAL : SubscriptionStatus.ACTIVE;
    subscription.initialize(id, initial, at);
    subscription.raise(SUBSCRIPTION_CREATED, subscription.payload(null, initial, null), at);
    return subscription;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.SUBSCRIPTION;
  }

  @Override
  protected TransitionTable<SubscriptionStatus, SubscriptionOperation> transitions() {
    return TRANSITIONS;
  }

  public void activate(Instant at) {
    transition(SubscriptionOperation.ACTIVATE)
        .emit(SUBSCRIPTION_ACTIVATED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  public void suspend(String reason, Instant at) {
    transition(SubscriptionOperation.SUSPEND)
        .emit(SUBSCRIPTION_SUSPENDED, (from, to) -> payload(from, to, reason))
        .apply(at);
  }

  public void cancel(String reason, Instant at) {
    transition(SubscriptionOperation.CANCEL)
        .guard(() -> requireText(reason, "reason"))
        .emit(SUBSCRIPTION_CANCELLED, (from, to) -> payload(from, to, reason))
        .effect(
            () -> {
              cancellationReason = reason;
              cancelledAt = at;
              autoRenew = false;
            })
        .apply(at);
  }

  /** 試用中は試用終了日、有効中は契約終了日を過ぎている場合のみ期限切れにできる。 */
  public void expire(Instant at) {
    transition(SubscriptionOperation.EXPIRE)
        .guard(
            () -> {
              final Instant deadline =
                  status() == SubscriptionStatus.TRIAL && trialEndDate != null
                      ? trialEndDate
                      : endDate;
              if (at.isBefore(deadline)) {
                throw new DomainRuleViolationException("subscription has not reached " + deadline);
              }
            })
        .emit(SUBSCRIPTION_EXPIRED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  public void renew(Duration billingPeriod, Instant at) {
    transition(SubscriptionOperation.RENEW)
        .guard(() -> requirePositivePeriod(billingPeriod, "billingPeriod"))
        .emit(
            SUBSCRIPTION_RENEWED,
            (from, to) ->
                new SubscriptionEventPayload(
                    userId,
                    planId,
                    from.name(),
                    to.name(),
                    renewedEndDate(billingPeriod, at),
                    renewalCount + 1,
                    null))
        .effect(
            () -> {
              endDate = renewedEndDate(billingPeriod, at);
              renewalCount = renewalCount + 1;
            })
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(SubscriptionOperation.DELETE)
        .emit(SUBSCRIPTION_DELETED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  // 期限前の更新は現在の終了日から延長し、期限後は更新時点から数える
  private Instant renewedEndDate(Duration billingPeriod, Instant at) {
    final Instant base = endDate != null && endDate.isAfter(at) ? endDate : at;
    return base.plus(billingPeriod);
  }

  private static Duration requirePositivePeriod(Duration period, String field) {
    if (period == null || period.isZero() || period.isNegative()) {
      throw new DomainRuleViolationException(field + " must be positive");
    }
    return period;
  }

  private SubscriptionEventPayload payload(
      SubscriptionStatus from, SubscriptionStatus to, String reason) {
    return new SubscriptionEventPayload(
        userId, planId, from == null ? null : from.name(), to.name(), endDate, renewalCount, reason);
  }

  public UUID userId() {
    return userId;
  }

  public UUID planId() {
    return planId;
  }

  public Instant startDate() {
    return startDate;
  }

  public Instant trialEndDate() {
    return trialEndDate;
  }

  public Instant endDate() {
    return endDate;
  }

  public boolean autoRenew() {
    return autoRenew;
  }

  public int renewalCount() {
    return renewalCount;
  }

  public String cancellationReason() {
    return cancellationReason;
  }

  public Instant cancelledAt() {
    return cancelledAt;
  }
}
