package com.bbthechange.eventapi.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;
import java.time.Duration;

/**
 * Builds the DynamoDB clients shared by every request.
 * An endpoint override switches to DynamoDB Local / LocalStack with static credentials.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    private final String region;
    private final String endpoint;
    private final Duration apiCallTimeout;

    public DynamoDBConfig(@Value("${aws.region:us-east-1}") String region,
                          @Value("${aws.dynamodb.endpoint:}") String endpoint,
                          @Value("${aws.dynamodb.api-call-timeout:10s}") Duration apiCallTimeout) {
        this.region = region;
        this.endpoint = endpoint;
        this.apiCallTimeout = apiCallTimeout;
    }

    @Bean
    public DynamoDbClient dynamoDbClient() {
        var builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .build())
                .credentialsProvider(credentialsProvider());

        if (usesLocalEndpoint()) {
            logger.info("Using DynamoDB endpoint override {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    boolean usesLocalEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    private AwsCredentialsProvider credentialsProvider() {
        if (usesLocalEndpoint()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("dummykey", "dummysecret"));
        }
        return DefaultCredentialsProvider.create();
    }
}
