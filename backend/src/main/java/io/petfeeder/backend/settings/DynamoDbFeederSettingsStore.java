package io.petfeeder.backend.settings;

import static io.petfeeder.backend.dynamodb.DynamoDbItems.getString;
import static io.petfeeder.backend.dynamodb.DynamoDbItems.number;
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
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/** Config table access: partition key {@code config_key}, setting in {@code value}. */
@Component
@ConditionalOnProperty(
    name = "feeder.store.provider",
    havingValue = "dynamodb",
    matchIfMissing = true)
public class DynamoDbFeederSettingsStore implements FeederSettingsStore {

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  public DynamoDbFeederSettingsStore(DynamoDbClient dynamoDbClient, DynamoDbProperties properties) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = properties.tables().config();
  }

  @Override
  public Optional<String> findValue(String key) {
    try {
      var response =
          dynamoDbClient.getItem(
              GetItemRequest.builder()
                  .tableName(tableName)
                  .key(Map.of("config_key", string(key)))
                  .build());
      if (!response.hasItem()) {
        return Optional.empty();
      }
      return Optional.ofNullable(getString(response.item(), "value"));
    } catch (SdkException e) {
      throw new StoreException("Failed to read setting " + key, e);
    }
  }

  @Override
  public void save(String key, Object value) {
    var stored = value instanceof Number n ? number(n) : string(String.valueOf(value));
    try {
      dynamoDbClient.putItem(
          PutItemRequest.builder()
              .tableName(tableName)
              .item(Map.of("config_key", string(key), "value", stored))
              .build());
    } catch (SdkException e) {
      throw new StoreException("Failed to write setting " + key, e);
    }
  }
}
