/*
 * どこで: マーケティング (ライブ配信) 集約
 * 何を: 予約 -> 配信中 <-> 一時停止 -> 終了 の配信状態
 * なぜ: 配信中のまま削除・取消されることを防ぐため
 */
package com.example.backoffice.model.marketing;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.TransitionTable;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class LiveStream extends AggregateRoot<LiveStreamStatus, LiveStreamOperation> {

  public static final String LIVE_STREAM_CREATED = "LiveStreamCreated";
  public static final String LIVE_STREAM_STARTED = "LiveStreamStarted";
  public static final String LIVE_STREAM_PAUSED = "LiveStreamPaused";
  public static final String LIVE_STREAM_RESUMED = "LiveStreamResumed";
  public static final String LIVE_STREAM_ENDED = "LiveStreamEnded";
  public static final String LIVE_STREAM_CANCELLED = "LiveStreamCancelled";
  public static final String LIVE_STREAM_DELETED = "LiveStreamDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(
          LIVE_STREAM_CREATED,
          LIVE_STREAM_STARTED,
          LIVE_STREAM_PAUSED,
          LIVE_STREAM_RESUMED,
          LIVE_STREAM_ENDED,
          LIVE_STREAM_CANCELLED,
          LIVE_STREAM_DELETED);

  static final TransitionTable<LiveStreamStatus, LiveStreamOperation> TRANSITIONS =
      TransitionTable.builder("LiveStream", LiveStreamStatus.class, LiveStreamOperation.class)
          .permit(LiveStreamStatus.SCHEDULED, LiveStreamOperation.START, LiveStreamStatus.LIVE)
          .permit(LiveStreamStatus.LIVE, LiveStreamOperation.PAUSE, LiveStreamStatus.PAUSED)
          .permit(LiveStreamStatus.PAUSED, LiveStreamOperation.RESUME, LiveStreamStatus.LIVE)
          .permitFrom(
              LiveStreamOperation.END,
              LiveStreamStatus.ENDED,
              LiveStreamStatus.LIVE,
              LiveStreamStatus.PAUSED)
          .permitFrom(
              LiveStreamOperation.CANCEL,
              LiveStreamStatus.CANCELLED,
              LiveStreamStatus.SCHEDULED,
              LiveStreamStatus.PAUSED)
          .permitFromAllExcept(
              LiveStreamOperation.DELETE, LiveStreamStatus.DELETED, LiveStreamStatus.LIVE)
          .deletedState(LiveStreamStatus.DELETED)
          .build();

  private UUID sellerId;
  private String title;
  private Instant scheduledStartAt;
  private Instant actualStartAt;
  private Instant endedAt;
  private int peakViewerCount;

  private LiveStream() {}

  public static LiveStream create(
      UUID id, UUID sellerId, String title, Instant scheduledStartAt, Instant at) {
    final LiveStream stream = new LiveStream();
    stream.sellerId = requirePresent(sellerId, "sellerId");
    stream.title = requireText(title, "title");
    stream.scheduledStartAt = requirePresent(scheduledStartAt, "scheduledStartAt");
    stream.initialize(id, LiveStreamStatus.SCHEDULED, at);
    stream.raise(LIVE_STREAM_CREATED, stream.payload(null, LiveStreamStatus.SCHEDULED), at);
    return stream;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.LIVE_STREAM;
  }

  @Override
  protected TransitionTable<LiveStreamStatus, LiveStreamOperation> transitions() {
    return TRANSITIONS;
  }

  public void start(Instant at) {
    transition(LiveStreamOperation.START)
        .emit(LIVE_STREAM_STARTED, this::payload)
        .effect(() -> actualStartAt = at)
        .apply(at);
  }

  public void pause(Instant at) {
    transition(LiveStreamOperation.PAUSE).emit(LIVE_STREAM_PAUSED, this::payload).apply(at);
  }

  public void resume(Instant at) {
    transition(LiveStreamOperation.RESUME).emit(LIVE_STREAM_RESUMED, this::payload).apply(at);
  }

  public void end(int peakViewers, Instant at) {
    transition(LiveStreamOperation.END)
        .emit(
            LIVE_STREAM_ENDED,
            (from, to) ->
                new LiveStreamEventPayload(
                    sellerId,
                    title,
                    from.name(),
                    to.name(),
                    scheduledStartAt,
                    Math.max(peakViewerCount, peakViewers)))
        .effect(
            () -> {
              peakViewerCount = Math.max(peakViewerCount, peakViewers);
              endedAt = at;
            })
        .apply(at);
  }

  public void cancel(Instant at) {
    transition(LiveStreamOperation.CANCEL).emit(LIVE_STREAM_CANCELLED, this::payload).apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(LiveStreamOperation.DELETE).emit(LIVE_STREAM_DELETED, this::payload).apply(at);
  }

  private LiveStreamEventPayload payload(LiveStreamStatus from, LiveStreamStatus to) {
    return new LiveStreamEventPayload(
        sellerId,
        title,
        from == null ? null : from.name(),
        to.name(),
        scheduledStartAt,
        peakViewerCount);
  }

  public UUID sellerId() {
    return sellerId;
  }

  public String title() {
    return title;
  }

  public Instant scheduledStartAt() {
    return scheduledStartAt;
  }

  public Instant actualStartAt() {
    return actualStartAt;
  }

  public Instant endedAt() {
    return endedAt;
  }

  public int peakViewerCount() {
    return peakViewerCount;
  }
}
