package io.petfeeder.backend.dynamodb;

import java.math.BigDecimal;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Attribute conversions shared by the DynamoDB adapters. Readers are lenient: items can be written
 * by other tools, so a missing or differently-typed attribute yields the fallback instead of an
 * error.
 */
public final class DynamoDbItems {

  private DynamoDbItems() {}

  public static AttributeValue string(String value) {
    return AttributeValue.builder().s(value).build();
  }

  public static AttributeValue number(Number value) {
    return AttributeValue.builder().n(value.toString()).build();
  }

  public static AttributeValue bool(boolean value) {
    return AttributeValue.builder().bool(value).build();
  }

  /** Puts {@code value} as a string attribute unless it is null. */
  public static void putIfPresent(Map<String, AttributeValue> item, String key, String value) {
    if (value != null) {
      item.put(key, string(value));
    }
  }

  public static String getString(Map<String, AttributeValue> item, String key) {
    AttributeValue value = item.get(key);
    if (value == null) {
      return null;
    }
    if (value.s() != null) {
      return value.s();
    }
    return value.n();
  }

  public static String getString(Map<String, AttributeValue> item, String key, String fallback) {
    String value = getString(item, key);
    return value != null ? value : fallback;
  }

  public static int getInt(Map<String, AttributeValue> item, String key, int fallback) {
    Double value = getDouble(item, key);
    return value != null ? value.intValue() : fallback;
  }

  public static Double getDouble(Map<String, AttributeValue> item, String key) {
    String raw = getString(item, key);
    if (raw == null) {
      return null;
    }
    try {
      return new BigDecimal(raw).doubleValue();
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public static boolean getBoolean(Map<String, AttributeValue> item, String key, boolean fallback) {
    AttributeValue value = item.get(key);
    if (value == null || value.bool() == null) {
      return fallback;
    }
    return value.bool();
  }
}
