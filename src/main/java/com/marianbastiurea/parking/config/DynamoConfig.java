package com.marianbastiurea.parking.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/** DynamoDB clients for the simulation archive; only wired when {@code app.dynamo.enabled=true}. */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "app.dynamo.enabled", havingValue = "true")
public class DynamoConfig {

    private static final Logger log = LoggerFactory.getLogger(DynamoConfig.class);

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public Region awsRegion(@Value("${aws.region:us-east-1}") String region) {
        Region resolved = Region.of(region);
        log.info("AWS region configured: {}", resolved);
        return resolved;
    }

    @Bean(destroyMethod = "close")
    public DynamoDbClient dynamoDbClient(Region region,
                                         AwsCredentialsProvider creds,
                                         @Value("${aws.dynamodb.endpoint-override:}") String endpointOverride) {
        boolean override = endpointOverride != null && !endpointOverride.isBlank();
        log.info("Building DynamoDbClient (region={}, endpointOverride={})", region, override ? endpointOverride : "<none>");

        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(region)
                .credentialsProvider(creds);
        if (override) {
            builder.endpointOverride(URI.create(endpointOverride));
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient enhancedClient(DynamoDbClient client) {
        log.info("Creating DynamoDbEnhancedClient.");
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(client)
                .build();
    }
}
