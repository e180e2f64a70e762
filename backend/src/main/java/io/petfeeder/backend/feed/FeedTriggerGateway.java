package io.petfeeder.backend.feed;

/**
 * Entry point for dispensing food. Implementations may veto a request (see {@link
 * FeedStatus#DENIED_WEIGHT_EXCEEDED}); callers must treat any status other than a successful one as
 * "nothing was dispensed".
 */
public interface FeedTriggerGateway {

  /** Never throws for device or store failures; those are reported as {@link FeedStatus#FAILED}. */
  FeedResult trigger(FeedRequest request);
}
