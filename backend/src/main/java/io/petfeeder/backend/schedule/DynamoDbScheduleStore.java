package io.petfeeder.backend.schedule;

import static io.petfeeder.backend.dynamodb.DynamoDbItems.bool;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.getBoolean;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.getInt;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.getString;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.number;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.putIfPresent;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.string;

import io.petfeeder.backend.config.DynamoDbConfig.DynamoDbProperties;
import io.petfeeder.backend.exception.StoreException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/** DynamoDB implementation of {@link ScheduleStore}. AWS SDK types do not leave this class. */
@Component
@ConditionalOnProperty(
    name = "feeder.store.provider",
    havingValue = "dynamodb",
    matchIfMissing = true)
public class DynamoDbScheduleStore implements ScheduleStore {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbScheduleStore.class);

  static final String SCHEDULE_ID = "schedule_id";
  static final String REQUESTED_BY = "requested_by";
  static final String SCHEDULED_TIME = "scheduled_time";
  static final String FEED_CYCLES = "feed_cycles";
  static final String RECURRENCE = "recurrence";
  static final String ENABLED = "enabled";
  static final String TIMEZONE = "timezone";
  static final String LAST_EXECUTED_AT = "last_executed_at";
  static final String CREATED_AT = "created_at";
  static final String UPDATED_AT = "updated_at";

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  public DynamoDbScheduleStore(DynamoDbClient dynamoDbClient, DynamoDbProperties properties) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = properties.tables().schedules();
  }

  @Override
  public List<FeedSchedule> scanEnabled() {
    var request =
        ScanRequest.builder()
            .tableName(tableName)
            .filterExpression("#enabled = :enabled")
            .expressionAttributeNames(Map.of("#enabled", ENABLED))
            .expressionAttributeValues(Map.of(":enabled", bool(true)))
            .build();
    return scan(request);
  }

  @Override
  public List<FeedSchedule> findAll(String requestedBy) {
    var builder = ScanRequest.builder().tableName(tableName);
    if (requestedBy != null) {
      builder
          .filterExpression("#requested_by = :requested_by")
          .expressionAttributeNames(Map.of("#requested_by", REQUESTED_BY))
          .expressionAttributeValues(Map.of(":requested_by", string(requestedBy)));
    }
    return scan(builder.build());
  }

  @Override
  public Optional<FeedSchedule> findById(String scheduleId) {
    try {
      var response =
          dynamoDbClient.getItem(
              GetItemRequest.builder()
                  .tableName(tableName)
                  .key(key(scheduleId))
                  .consistentRead(true)
                  .build());
      if (!response.hasItem() || response.item().isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(fromItem(response.item()));
    } catch (SdkException e) {
      throw new StoreException("Failed to read schedule " + scheduleId, e);
    }
  }

  @Override
  public FeedSchedule put(FeedSchedule schedule) {
    try {
      dynamoDbClient.putItem(
          PutItemRequest.builder().tableName(tableName).item(toItem(schedule)).build());
      return schedule;
    } catch (SdkException e) {
      throw new StoreException("Failed to write schedule " + schedule.scheduleId(), e);
    }
  }

  @Override
  public FeedSchedule update(String scheduleId, ScheduleUpdate update) {
    var expression = new UpdateExpression();
    expression.set(SCHEDULED_TIME, update.scheduledTime());
    if (update.feedCycles() != null) {
      expression.set(FEED_CYCLES, number(update.feedCycles()));
    }
    expression.set(RECURRENCE, update.recurrence());
    if (update.enabled() != null) {
      expression.set(ENABLED, bool(update.enabled()));
    }
    expression.set(TIMEZONE, update.timezone());
    expression.set(UPDATED_AT, update.updatedAt());
    if (update.clearLastExecutedAt()) {
      expression.remove(LAST_EXECUTED_AT);
    } else {
      expression.set(LAST_EXECUTED_AT, update.lastExecutedAt());
    }

    String condition = "attribute_exists(" + expression.name(SCHEDULE_ID) + ")";
    if (update.unfiredOccurrence() != null) {
      String occurrence = expression.value("occurrence", string(update.unfiredOccurrence()));
      String lastExecuted = expression.name(LAST_EXECUTED_AT);
      condition +=
          " AND "
              + expression.name(SCHEDULED_TIME)
              + " = "
              + occurrence
              + " AND (attribute_not_exists("
              + lastExecuted
              + ") OR "
              + lastExecuted
              + " <> "
              + occurrence
              + ")";
    }

    var request =
        UpdateItemRequest.builder()
            .tableName(tableName)
            .key(key(scheduleId))
            .updateExpression(expression.render())
            .conditionExpression(condition)
            .expressionAttributeNames(expression.names)
            .expressionAttributeValues(expression.values.isEmpty() ? null : expression.values)
            .returnValues(ReturnValue.ALL_NEW)
            .build();
    try {
      return fromItem(dynamoDbClient.updateItem(request).attributes());
    } catch (ConditionalCheckFailedException e) {
      log.warn("Conditional update rejected for schedule {}", scheduleId);
      throw new ScheduleConflictException(scheduleId, e);
    } catch (SdkException e) {
      throw new StoreException("Failed to update schedule " + scheduleId, e);
    }
  }

  @Override
  public void delete(String scheduleId) {
    try {
      dynamoDbClient.deleteItem(
          DeleteItemRequest.builder().tableName(tableName).key(key(scheduleId)).build());
    } catch (SdkException e) {
      throw new StoreException("Failed to delete schedule " + scheduleId, e);
    }
  }

  private List<FeedSchedule> scan(ScanRequest request) {
    try {
      var schedules = new ArrayList<FeedSchedule>();
      dynamoDbClient.scanPaginator(request).items().forEach(item -> schedules.add(fromItem(item)));
      return schedules;
    } catch (SdkException e) {
      throw new StoreException("Failed to scan schedule table", e);
    }
  }

  private static Map<String, AttributeValue> key(String scheduleId) {
    return Map.of(SCHEDULE_ID, string(scheduleId));
  }

  static Map<String, AttributeValue> toItem(FeedSchedule schedule) {
    var item = new HashMap<String, AttributeValue>();
    item.put(SCHEDULE_ID, string(schedule.scheduleId()));
    putIfPresent(item, REQUESTED_BY, schedule.requestedBy());
    putIfPresent(item, SCHEDULED_TIME, schedule.scheduledTime());
    item.put(FEED_CYCLES, number(schedule.feedCycles()));
    putIfPresent(item, RECURRENCE, schedule.recurrence());
    item.put(ENABLED, bool(schedule.enabled()));
    putIfPresent(item, TIMEZONE, schedule.timezone());
    putIfPresent(item, LAST_EXECUTED_AT, schedule.lastExecutedAt());
    putIfPresent(item, CREATED_AT, schedule.createdAt());
    putIfPresent(item, UPDATED_AT, schedule.updatedAt());
    return item;
  }

  static FeedSchedule fromItem(Map<String, AttributeValue> item) {
    return new FeedSchedule(
        getString(item, SCHEDULE_ID),
        getString(item, REQUESTED_BY, "scheduler"),
        getString(item, SCHEDULED_TIME),
        getInt(item, FEED_CYCLES, 1),
        getString(item, RECURRENCE, Recurrence.NONE.value()),
        getBoolean(item, ENABLED, false),
        getString(item, TIMEZONE, "UTC"),
        getString(item, LAST_EXECUTED_AT),
        getString(item, CREATED_AT),
        getString(item, UPDATED_AT));
  }

  /** Collects SET/REMOVE clauses with placeholder names, registering only what is referenced. */
  private static final class UpdateExpression {

    private final List<String> sets = new ArrayList<>();
    private final List<String> removes = new ArrayList<>();
    private final Map<String, String> names = new HashMap<>();
    private final Map<String, AttributeValue> values = new HashMap<>();

    String name(String attribute) {
      String placeholder = "#" + attribute;
      names.put(placeholder, attribute);
      return placeholder;
    }

    String value(String label, AttributeValue value) {
      String placeholder = ":" + label;
      values.put(placeholder, value);
      return placeholder;
    }

    void set(String attribute, AttributeValue value) {
      sets.add(name(attribute) + " = " + value(attribute, value));
    }

    void set(String attribute, String value) {
      if (value != null) {
        set(attribute, string(value));
      }
    }

    void remove(String attribute) {
      removes.add(name(attribute));
    }

    String render() {
      var clauses = new ArrayList<String>();
      if (!sets.isEmpty()) {
        clauses.add("SET " + String.join(", ", sets));
      }
      if (!removes.isEmpty()) {
        clauses.add("REMOVE " + String.join(", ", removes));
      }
      if (clauses.isEmpty()) {
        throw new IllegalArgumentException("Schedule update has no changes");
      }
      return String.join(" ", clauses);
    }
  }
}
