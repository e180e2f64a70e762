package io.petfeeder.backend.feed;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "feeder.store.provider", havingValue = "memory")
public class InMemoryFeedEventLog implements FeedEventLog {

  private final List<FeedResult> events = new CopyOnWriteArrayList<>();

  @Override
  public void append(FeedResult event) {
    events.add(event);
  }

  @Override
  public List<FeedResult> findRecent(int limit) {
    return events.stream()
        .sorted(Comparator.comparing(FeedResult::timestamp).reversed())
        .limit(limit)
        .toList();
  }
}
