/*
 * どこで: マーケティング (メールキャンペーン) 集約
 * 何を: 下書き -> 予約 -> 送信 -> 完了/失敗 の配信ライフサイクル
 * なぜ: 送信中のキャンペーンの取消/削除を防ぐため
 */
package com.example.backoffice.model.marketing;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.DomainRuleViolationException;
import com.example.backoffice.model.TransitionTable;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class EmailCampaign extends AggregateRoot<EmailCampaignStatus, EmailCampaignOperation> {

  public static final String EMAIL_CAMPAIGN_CREATED = "EmailCampaignCreated";
  public static final String EMAIL_CAMPAIGN_SCHEDULED = "EmailCampaignScheduled";
  public static final String EMAIL_CAMPAIGN_SENDING_STARTED = "EmailCampaignSendingStarted";
  public static final String EMAIL_CAMPAIGN_PAUSED = "EmailCampaignPaused";
  public static final String EMAIL_CAMPAIGN_RESUMED = "EmailCampaignResumed";
  public static final String EMAIL_CAMPAIGN_SENT = "EmailCampaignSent";
  public static final String EMAIL_CAMPAIGN_FAILED = "EmailCampaignFailed";
  public static final String EMAIL_CAMPAIGN_CANCELLED = "EmailCampaignCancelled";
  public static final String EMAIL_CAMPAIGN_DELETED = "EmailCampaignDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(
          EMAIL_CAMPAIGN_CREATED,
          EMAIL_CAMPAIGN_SCHEDULED,
          EMAIL_CAMPAIGN_SENDING_STARTED,
          EMAIL_CAMPAIGN_PAUSED,
          EMAIL_CAMPAIGN_RESUMED,
          EMAIL_CAMPAIGN_SENT,
          EMAIL_CAMPAIGN_FAILED,
          EMAIL_CAMPAIGN_CANCELLED,
          EMAIL_CAMPAIGN_DELETED);

  static final TransitionTable<EmailCampaignStatus, EmailCampaignOperation> TRANSITIONS =
      TransitionTable.builder(
              "EmailCampaign", EmailCampaignStatus.class, EmailCampaignOperation.class)
          .permit(
              EmailCampaignStatus.DRAFT,
              EmailCampaignOperation.SCHEDULE,
              EmailCampaignStatus.SCHEDULED)
          .permitFrom(
              EmailCampaignOperation.START_SENDING,
              EmailCampaignStatus.SENDING,
              EmailCampaignStatus.DRAFT,
              EmailCampaignStatus.SCHEDULED)
          .permit(
              EmailCampaignStatus.SENDING, EmailCampaignOperation.PAUSE, EmailCampaignStatus.PAUSED)
          .permit(
              EmailCampaignStatus.PAUSED, EmailCampaignOperation.RESUME, EmailCampaignStatus.SENDING)
          .permit(
              EmailCampaignStatus.SENDING, EmailCampaignOperation.MARK_SENT, EmailCampaignStatus.SENT)
          .permit(
              EmailCampaignStatus.SENDING,
              EmailCampaignOperation.MARK_FAILED,
              EmailCampaignStatus.FAILED)
          .permitFrom(
              EmailCampaignOperation.CANCEL,
              EmailCampaignStatus.CANCELLED,
              EmailCampaignStatus.DRAFT,
              EmailCampaignStatus.SCHEDULED,
              EmailCampaignStatus.PAUSED)
          .permitFromAllExcept(
              EmailCampaignOperation.DELETE, EmailCampaignStatus.DELETED, EmailCampaignStatus.SENDING)
          .deletedState(EmailCampaignStatus.DELETED)
          .build();

  private String name;
  private String subject;
  private String templateId;
  private Instant scheduledAt;
  private Instant startedAt;
  private Instant completedAt;
  private int totalRecipients;
  private int sentCount;
  private String failureReason;

  private EmailCampaign() {}

  public static EmailCampaign create(
      UUID id, String name, String subject, String templateId, Instant at) {
    final EmailCampaign campaign = new EmailCampaign();
    campaign.name = requireText(name, "name");
    campaign.subject = requireText(subject, "subject");
    campaign.templateId = templateId;
    campaign.initialize(id, EmailCampaignStatus.DRAFT, at);
    campaign.raise(
        EMAIL_CAMPAIGN_CREATED, campaign.payload(null, EmailCampaignStatus.DRAFT, null), at);
    return campaign;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.EMAIL_CAMPAIGN;
  }

  @Override
  protected TransitionTable<EmailCampaignStatus, EmailCampaignOperation> transitions() {
    return TRANSITIONS;
  }

  public void schedule(Instant sendAt, Instant at) {
    transition(EmailCampaignOperation.SCHEDULE)
        .guard(
            () -> {
              if (sendAt == null || !sendAt.isAfter(at)) {
                throw new DomainRuleViolationException("scheduledAt must be in the future");
              }
            })
        .emit(
            EMAIL_CAMPAIGN_SCHEDULED,
            (from, to) ->
                new EmailCampaignEventPayload(
                    name, subject, from.name(), to.name(), sendAt, null, null, null))
        .effect(() -> scheduledAt = sendAt)
        .apply(at);
  }

  public void startSending(int recipients, Instant at) {
    transition(EmailCampaignOperation.START_SENDING)
        .guard(() -> requirePositive(recipients, "totalRecipients"))
        .emit(
            EMAIL_CAMPAIGN_SENDING_STARTED,
            (from, to) ->
                new EmailCampaignEventPayload(
                    name, subject, from.name(), to.name(), scheduledAt, recipients, 0, null))
        .effect(
            () -> {
              totalRecipients = recipients;
              sentCount = 0;
              startedAt = at;
            })
        .apply(at);
  }

  public void pause(Instant at) {
    transition(EmailCampaignOperation.PAUSE)
        .emit(EMAIL_CAMPAIGN_PAUSED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  public void resume(Instant at) {
    transition(EmailCampaignOperation.RESUME)
        .emit(EMAIL_CAMPAIGN_RESUMED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  public void markSent(int delivered, Instant at) {
    transition(EmailCampaignOperation.MARK_SENT)
        .guard(
            () -> {
              if (delivered < 0 || delivered > totalRecipients) {
                throw new DomainRuleViolationException(
                    "sentCount must be between 0 and " + totalRecipients);
              }
            })
        .emit(
            EMAIL_CAMPAIGN_SENT,
            (from, to) ->
                new EmailCampaignEventPayload(
                    name,
                    subject,
                    from.name(),
                    to.name(),
                    scheduledAt,
                    totalRecipients,
                    delivered,
                    null))
        .effect(
            () -> {
              sentCount = delivered;
              completedAt = at;
            })
        .apply(at);
  }

  public void markFailed(String reason, Instant at) {
    transition(EmailCampaignOperation.MARK_FAILED)
        .guard(() -> requireText(reason, "reason"))
        .emit(EMAIL_CAMPAIGN_FAILED, (from, to) -> payload(from, to, reason))
        .effect(
            () -> {
              failureReason = reason;
              completedAt = at;
            })
        .apply(at);
  }

  public void cancel(Instant at) {
    transition(EmailCampaignOperation.CANCEL)
        .emit(EMAIL_CAMPAIGN_CANCELLED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(EmailCampaignOperation.DELETE)
        .emit(EMAIL_CAMPAIGN_DELETED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  private EmailCampaignEventPayload payload(
      EmailCampaignStatus from, EmailCampaignStatus to, String reason) {
    return new EmailCampaignEventPayload(
        name,
        subject,
        from == null ? null : from.name(),
        to.name(),
        scheduledAt,
        totalRecipients,
        sentCount,
        reason);
  }

  public String name() {
    return name;
  }

  public String subject() {
    return subject;
  }

  public String templateId() {
    return templateId;
  }

  public Instant scheduledAt() {
    return scheduledAt;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant completedAt() {
    return completedAt;
  }

  public int totalRecipients() {
    return totalRecipients;
  }

  public int sentCount() {
    return sentCount;
  }

  public String failureReason() {
    return failureReason;
  }
}
