package io.petfeeder.backend.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iotdataplane.IotDataPlaneClient;

@Configuration
@EnableConfigurationProperties(IotConfig.IotProperties.class)
public class IotConfig {

  /**
   * @param endpoint account-specific IoT data endpoint host, without scheme
   * @param region AWS region of the IoT endpoint
   * @param thingId the feeder's thing name; also the device-status table key
   * @param commandTopic MQTT topic the device subscribes to for feed commands
   */
  @ConfigurationProperties("aws.iot")
  public record IotProperties(
      String endpoint, String region, String thingId, String commandTopic) {}

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "feeder.hardware.mode", havingValue = "iot", matchIfMissing = true)
  IotDataPlaneClient iotDataPlaneClient(IotProperties props) {
    var builder =
        IotDataPlaneClient.builder()
            .region(Region.of(props.region()))
            .credentialsProvider(DefaultCredentialsProvider.create());

    if (props.endpoint() != null && !props.endpoint().isBlank()) {
      builder.endpointOverride(URI.create("https://" + props.endpoint()));
    }

    return builder.build();
  }
}
