package io.petfeeder.backend.feed;

/**
 * @param scheduleId the firing schedule for {@link FeedMode#SCHEDULED} requests, otherwise null
 */
public record FeedRequest(String requestedBy, FeedMode mode, int feedCycles, String scheduleId) {

  public static FeedRequest scheduled(String scheduleId, int feedCycles, String requestedBy) {
    return new FeedRequest(requestedBy, FeedMode.SCHEDULED, feedCycles, scheduleId);
  }
}
