package io.petfeeder.backend.feed;

/** A processed feed request. Also the row written to the feed event log. */
public record FeedResult(
    String feedId,
    String requestedBy,
    FeedMode mode,
    FeedStatus status,
    String timestamp,
    String eventType,
    int feedCycles,
    String scheduleId) {

  public boolean isSuccessful() {
    return status.isSuccessful();
  }
}
