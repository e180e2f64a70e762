package io.petfeeder.backend.feed;

import static io.petfeeder.backend.dynamodb.DynamoDbItems.getInt;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.getString;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.number;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.putIfPresent;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.string;

import io.petfeeder.backend.config.DynamoDbConfig.DynamoDbProperties;
import io.petfeeder.backend.exception.StoreException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

/**
 * Feed events in DynamoDB, keyed by {@code feed_id}. Reads scan the whole table and sort in memory;
 * a timestamp index would be needed once the table grows large.
 */
@Component
@ConditionalOnProperty(
    name = "feeder.store.provider",
    havingValue = "dynamodb",
    matchIfMissing = true)
public class DynamoDbFeedEventLog implements FeedEventLog {

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  public DynamoDbFeedEventLog(DynamoDbClient dynamoDbClient, DynamoDbProperties properties) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = properties.tables().feedEvents();
  }

  @Override
  public void append(FeedResult event) {
    var item = new HashMap<String, AttributeValue>();
    item.put("feed_id", string(event.feedId()));
    putIfPresent(item, "requested_by", event.requestedBy());
    item.put("mode", string(event.mode().value()));
    item.put("status", string(event.status().value()));
    item.put("timestamp", string(event.timestamp()));
    item.put("event_type", string(event.eventType()));
    item.put("feed_cycles", number(event.feedCycles()));
    putIfPresent(item, "schedule_id", event.scheduleId());
    try {
      dynamoDbClient.putItem(PutItemRequest.builder().tableName(tableName).item(item).build());
    } catch (SdkException e) {
      throw new StoreException("Failed to write feed event " + event.feedId(), e);
    }
  }

  @Override
  public List<FeedResult> findRecent(int limit) {
    try {
      return dynamoDbClient
          .scanPaginator(ScanRequest.builder().tableName(tableName).build())
          .items()
          .stream()
          .map(DynamoDbFeedEventLog::fromItem)
          .sorted(
              Comparator.comparing(FeedResult::timestamp, Comparator.nullsFirst(String::compareTo))
                  .reversed())
          .limit(limit)
          .toList();
    } catch (SdkException e) {
      throw new StoreException("Failed to read feed events", e);
    }
  }

  private static FeedResult fromItem(Map<String, AttributeValue> item) {
    FeedMode mode;
    try {
      mode = FeedMode.fromValue(getString(item, "mode", FeedMode.MANUAL.value()));
    } catch (IllegalArgumentException e) {
      mode = FeedMode.MANUAL;
    }
    return new FeedResult(
        getString(item, "feed_id"),
        getString(item, "requested_by"),
        mode,
        FeedStatus.fromValue(getString(item, "status")),
        getString(item, "timestamp"),
        getString(item, "event_type", mode.eventType()),
        getInt(item, "feed_cycles", 1),
        getString(item, "schedule_id"));
  }
}
