package io.petfeeder.backend.feed;

import io.petfeeder.backend.feed.dto.CreateFeedRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/feeds")
public class FeedController {

  private final FeedService feedService;

  public FeedController(FeedService feedService) {
    this.feedService = feedService;
  }

  /** A vetoed or failed feed is still a processed request: 200 with the status in the body. */
  @PostMapping
  public ResponseEntity<FeedResult> feed(@Valid @RequestBody CreateFeedRequest request) {
    FeedMode mode = request.mode() != null ? FeedMode.fromValue(request.mode()) : FeedMode.MANUAL;
    int cycles = request.feedCycles() != null ? request.feedCycles() : 1;
    return ResponseEntity.ok(
        feedService.trigger(new FeedRequest(request.requestedBy(), mode, cycles, null)));
  }

  @GetMapping
  public ResponseEntity<List<FeedResult>> recentFeeds(
      @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(feedService.recentFeeds(Math.max(1, Math.min(limit, 100))));
  }
}
