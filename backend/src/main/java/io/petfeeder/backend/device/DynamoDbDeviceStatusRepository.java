package io.petfeeder.backend.device;

import static io.petfeeder.backend.dynamodb.DynamoDbItems.getDouble;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.getString;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.string;

import io.petfeeder.backend.config.DynamoDbConfig.DynamoDbProperties;
import io.petfeeder.backend.exception.StoreException;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;

/** Device-status table, partition key {@code thingId}, one item per device. */
@Component
@ConditionalOnProperty(
    name = "feeder.store.provider",
    havingValue = "dynamodb",
    matchIfMissing = true)
public class DynamoDbDeviceStatusRepository implements DeviceStatusRepository {

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  public DynamoDbDeviceStatusRepository(
      DynamoDbClient dynamoDbClient, DynamoDbProperties properties) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = properties.tables().deviceStatus();
  }

  @Override
  public Optional<DeviceStatus> findByThingId(String thingId) {
    try {
      var response =
          dynamoDbClient.getItem(
              GetItemRequest.builder()
                  .tableName(tableName)
                  .key(Map.of("thingId", string(thingId)))
                  .build());
      if (!response.hasItem() || response.item().isEmpty()) {
        return Optional.empty();
      }
      var item = response.item();
      return Optional.of(
          new DeviceStatus(
              getString(item, "thingId"),
              getString(item, "status"),
              getString(item, "network_status"),
              getDouble(item, "current_weight_g"),
              getString(item, "lastUpdated")));
    } catch (SdkException e) {
      throw new StoreException("Failed to read device status for " + thingId, e);
    }
  }
}
