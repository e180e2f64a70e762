package io.petfeeder.backend.feed;

import java.util.List;

/** Record of processed feed requests. */
public interface FeedEventLog {

  void append(FeedResult event);

  /** Newest first. */
  List<FeedResult> findRecent(int limit);
}
