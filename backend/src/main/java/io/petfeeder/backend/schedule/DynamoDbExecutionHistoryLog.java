package io.petfeeder.backend.schedule;

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
 * Execution history in DynamoDB, keyed by {@code execution_id}. Lookups by schedule scan the table;
 * history is an audit trail and is read rarely.
 */
@Component
@ConditionalOnProperty(
    name = "feeder.store.provider",
    havingValue = "dynamodb",
    matchIfMissing = true)
public class DynamoDbExecutionHistoryLog implements ExecutionHistoryLog {

  private static final Comparator<ScheduleExecution> NEWEST_FIRST =
      Comparator.comparing(
              ScheduleExecution::executedAt,
              Comparator.nullsFirst(Comparator.<String>naturalOrder()))
          .reversed();

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  public DynamoDbExecutionHistoryLog(DynamoDbClient dynamoDbClient, DynamoDbProperties properties) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = properties.tables().executionHistory();
  }

  @Override
  public void append(ScheduleExecution execution) {
    var item = new HashMap<String, AttributeValue>();
    item.put("execution_id", string(execution.executionId()));
    item.put("schedule_id", string(execution.scheduleId()));
    putIfPresent(item, "scheduled_time", execution.scheduledTime());
    item.put("executed_at", string(execution.executedAt()));
    item.put("status", string(execution.status().value()));
    item.put("feed_cycles", number(execution.feedCycles()));
    putIfPresent(item, "recurrence", execution.recurrence());
    putIfPresent(item, "requested_by", execution.requestedBy());
    putIfPresent(item, "error_message", execution.errorMessage());
    putIfPresent(item, "environment", execution.environment());
    try {
      dynamoDbClient.putItem(PutItemRequest.builder().tableName(tableName).item(item).build());
    } catch (SdkException e) {
      throw new StoreException("Failed to write execution history", e);
    }
  }

  @Override
  public List<ScheduleExecution> findBySchedule(String scheduleId, int limit) {
    var request =
        ScanRequest.builder()
            .tableName(tableName)
            .filterExpression("#schedule_id = :schedule_id")
            .expressionAttributeNames(Map.of("#schedule_id", "schedule_id"))
            .expressionAttributeValues(Map.of(":schedule_id", string(scheduleId)))
            .build();
    try {
      return dynamoDbClient.scanPaginator(request).items().stream()
          .map(DynamoDbExecutionHistoryLog::fromItem)
          .sorted(NEWEST_FIRST)
          .limit(limit)
          .toList();
    } catch (SdkException e) {
      throw new StoreException("Failed to read execution history for " + scheduleId, e);
    }
  }

  private static ScheduleExecution fromItem(Map<String, AttributeValue> item) {
    return new ScheduleExecution(
        getString(item, "execution_id"),
        getString(item, "schedule_id"),
        getString(item, "scheduled_time"),
        getString(item, "executed_at"),
        ExecutionStatus.fromValue(getString(item, "status")),
        getInt(item, "feed_cycles", 1),
        getString(item, "recurrence"),
        getString(item, "requested_by"),
        getString(item, "error_message"),
        getString(item, "environment"));
  }
}
