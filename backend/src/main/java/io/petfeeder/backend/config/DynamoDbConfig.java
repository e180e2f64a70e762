package io.petfeeder.backend.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Configuration
@EnableConfigurationProperties({
  DynamoDbConfig.DynamoDbProperties.class,
  DynamoDbConfig.AwsCredentialsProperties.class
})
public class DynamoDbConfig {

  @ConfigurationProperties("aws.dynamodb")
  public record DynamoDbProperties(String endpoint, String region, Tables tables) {}

  /** Table names, one per collaborator. */
  public record Tables(
      String schedules,
      String executionHistory,
      String feedEvents,
      String deviceStatus,
      String config) {}

  @ConfigurationProperties("aws.credentials")
  public record AwsCredentialsProperties(String accessKeyId, String secretAccessKey) {}

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(
      name = "feeder.store.provider",
      havingValue = "dynamodb",
      matchIfMissing = true)
  DynamoDbClient dynamoDbClient(DynamoDbProperties props, AwsCredentialsProperties credProps) {
    var builder = DynamoDbClient.builder().region(Region.of(props.region()));

    if (props.endpoint() != null && !props.endpoint().isBlank()) {
      builder
          .endpointOverride(URI.create(props.endpoint()))
          .credentialsProvider(
              StaticCredentialsProvider.create(
                  AwsBasicCredentials.create(
                      credProps.accessKeyId(), credProps.secretAccessKey())));
    } else {
      builder.credentialsProvider(DefaultCredentialsProvider.create());
    }

    return builder.build();
  }
}
