/*
 * どこで: サポート問い合わせ集約
 * 何を: 受付 -> 対応中 <-> 顧客待ち -> 解決/クローズ と再オープン
 * なぜ: 担当者なしで対応中にならないようにするため
 */
package com.example.backoffice.model.support;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.TransitionTable;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class SupportTicket extends AggregateRoot<SupportTicketStatus, SupportTicketOperation> {

  public static final String SUPPORT_TICKET_CREATED = "SupportTicketCreated";
  public static final String SUPPORT_TICKET_ASSIGNED = "SupportTicketAssigned";
  public static final String SUPPORT_TICKET_STATUS_CHANGED = "SupportTicketStatusChanged";
  public static final String SUPPORT_TICKET_RESOLVED = "SupportTicketResolved";
  public static final String SUPPORT_TICKET_CLOSED = "SupportTicketClosed";
  public static final String SUPPORT_TICKET_REOPENED = "SupportTicketReopened";
  public static final String SUPPORT_TICKET_DELETED = "SupportTicketDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(
          SUPPORT_TICKET_CREATED,
          SUPPORT_TICKET_ASSIGNED,
          SUPPORT_TICKET_STATUS_CHANGED,
          SUPPORT_TICKET_RESOLVED,
          SUPPORT_TICKET_CLOSED,
          SUPPORT_TICKET_REOPENED,
          SUPPORT_TICKET_DELETED);

  static final TransitionTable<SupportTicketStatus, SupportTicketOperation> TRANSITIONS =
      TransitionTable.builder(
              "SupportTicket", SupportTicketStatus.class, SupportTicketOperation.class)
          .permit(
              SupportTicketStatus.OPEN,
              SupportTicketOperation.ASSIGN,
              SupportTicketStatus.IN_PROGRESS)
          .permit(
              SupportTicketStatus.IN_PROGRESS,
              SupportTicketOperation.ASSIGN,
              SupportTicketStatus.IN_PROGRESS)
          .permit(
              SupportTicketStatus.IN_PROGRESS,
              SupportTicketOperation.AWAIT_CUSTOMER,
              SupportTicketStatus.WAITING)
          .permit(
              SupportTicketStatus.WAITING,
              SupportTicketOperation.RESUME,
              SupportTicketStatus.IN_PROGRESS)
          .permitFrom(
              SupportTicketOperation.RESOLVE,
              SupportTicketStatus.RESOLVED,
              SupportTicketStatus.OPEN,
              SupportTicketStatus.IN_PROGRESS,
              SupportTicketStatus.WAITING)
          .permitFromAllExcept(
              SupportTicketOperation.CLOSE, SupportTicketStatus.CLOSED, SupportTicketStatus.DELETED)
          .permitFrom(
              SupportTicketOperation.REOPEN,
              SupportTicketStatus.OPEN,
              SupportTicketStatus.RESOLVED,
              SupportTicketStatus.CLOSED)
          .permitFromAllExcept(SupportTicketOperation.DELETE, SupportTicketStatus.DELETED)
          .deletedState(SupportTicketStatus.DELETED)
          .build();

  private String ticketNumber;
  private UUID userId;
  private String subject;
  private String description;
  private UUID assignedTo;
  private Instant resolvedAt;
  private Instant closedAt;
  private String resolutionNote;

  private SupportTicket() {}

  public static SupportTicket create(
      UUID id, String ticketNumber, UUID userId, String subject, String description, Instant at) {
    final SupportTicket ticket = new SupportTicket();
    ticket.ticketNumber = requireText(ticketNumber, "ticketNumber");
    ticket.userId = requirePresent(userId, "userId");
    ticket.subject = requireText(subject, "subject");
    ticket.description = description;
    ticket.initialize(id, SupportTicketStatus.OPEN, at);
    ticket.raise(SUPPORT_TICKET_CREATED, ticket.payload(null, SupportTicketStatus.OPEN, null), at);
    return ticket;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.SUPPORT_TICKET;
  }

  @Override
  protected TransitionTable<SupportTicketStatus, SupportTicketOperation> transitions() {
    return TRANSITIONS;
  }

  public void assign(UUID assignee, Instant at) {
    transition(SupportTicketOperation.ASSIGN)
        .guard(() -> requirePresent(assignee, "assignedTo"))
        .emit(
            SUPPORT_TICKET_ASSIGNED,
            (from, to) ->
                new SupportTicketEventPayload(
                    ticketNumber, userId, subject, from.name(), to.name(), assignee, null))
        .effect(() -> assignedTo = assignee)
        .apply(at);
  }

  public void awaitCustomer(String note, Instant at) {
    transition(SupportTicketOperation.AWAIT_CUSTOMER)
        .emit(SUPPORT_TICKET_STATUS_CHANGED, (from, to) -> payload(from, to, note))
        .apply(at);
  }

  public void resume(Instant at) {
    transition(SupportTicketOperation.RESUME)
        .emit(SUPPORT_TICKET_STATUS_CHANGED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  public void resolve(String note, Instant at) {
    transition(SupportTicketOperation.RESOLVE)
        .guard(() -> requireText(note, "resolutionNote"))
        .emit(SUPPORT_TICKET_RESOLVED, (from, to) -> payload(from, to, note))
        .effect(
            () -> {
              resolutionNote = note;
              resolvedAt = at;
            })
        .apply(at);
  }

  public void close(Instant at) {
    transition(SupportTicketOperation.CLOSE)
        .emit(SUPPORT_TICKET_CLOSED, (from, to) -> payload(from, to, null))
        .effect(() -> closedAt = at)
        .apply(at);
  }

  /** 再オープン時は担当者と解決情報をクリアする。 */
  public void reopen(String reason, Instant at) {
    transition(SupportTicketOperation.REOPEN)
        .emit(SUPPORT_TICKET_REOPENED, (from, to) -> payload(from, to, reason))
        .effect(
            () -> {
              assignedTo = null;
              resolutionNote = null;
              resolvedAt = null;
              closedAt = null;
            })
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(SupportTicketOperation.DELETE)
        .emit(SUPPORT_TICKET_DELETED, (from, to) -> payload(from, to, null))
        .apply(at);
  }

  private SupportTicketEventPayload payload(
      SupportTicketStatus from, SupportTicketStatus to, String note) {
    return new SupportTicketEventPayload(
        ticketNumber, userId, subject, from == null ? null : from.name(), to.name(), assignedTo, note);
  }

  public String ticketNumber() {
    return ticketNumber;
  }

  public UUID userId() {
    return userId;
  }

  public String subject() {
    return subject;
  }

  public String description() {
    return description;
  }

  public UUID assignedTo() {
    return assignedTo;
  }

  public String resolutionNote() {
    return resolutionNote;
  }

  public Instant resolvedAt() {
    return resolvedAt;
  }

  public Instant closedAt() {
    return closedAt;
  }
}
