package io.petfeeder.backend.dynamodb;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class DynamoDbItemsTest {

  @Test
  void readers_toleratePresentAbsentAndMistypedAttributes() {
    Map<String, AttributeValue> item =
        Map.of(
            "cycles", AttributeValue.builder().n("3").build(),
            "weight", AttributeValue.builder().n("412.5").build(),
            "text_number", AttributeValue.builder().s("7").build(),
            "junk", AttributeValue.builder().s("n/a").build(),
            "flag", AttributeValue.builder().bool(true).build());

    assertThat(DynamoDbItems.getInt(item, "cycles", 1)).isEqualTo(3);
    assertThat(DynamoDbItems.getInt(item, "text_number", 1)).isEqualTo(7);
    assertThat(DynamoDbItems.getInt(item, "junk", 1)).isEqualTo(1);
    assertThat(DynamoDbItems.getInt(item, "missing", 1)).isEqualTo(1);
    assertThat(DynamoDbItems.getDouble(item, "weight")).isEqualTo(412.5);
    assertThat(DynamoDbItems.getString(item, "cycles")).isEqualTo("3");
    assertThat(DynamoDbItems.getString(item, "missing", "fallback")).isEqualTo("fallback");
    assertThat(DynamoDbItems.getBoolean(item, "flag", false)).isTrue();
    assertThat(DynamoDbItems.getBoolean(item, "cycles", false)).isFalse();
  }
}
