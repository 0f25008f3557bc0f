package com.bbthechange.eventapi.config;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DynamoDBConfigTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void dynamoDbClient_WithDefaultRegion_ShouldCreateClient() {
        DynamoDBConfig config = new DynamoDBConfig("us-east-1", "", TIMEOUT);

        try (DynamoDbClient client = config.dynamoDbClient()) {
            assertNotNull(client);
            assertEquals("us-east-1", client.serviceClientConfiguration().region().id());
        }
    }

    @Test
    void dynamoDbClient_WithLocalEndpoint_ShouldOverrideEndpoint() {
        DynamoDBConfig config = new DynamoDBConfig("eu-west-1", "http://localhost:8000", TIMEOUT);

        try (DynamoDbClient client = config.dynamoDbClient()) {
            assertTrue(config.usesLocalEndpoint());
            assertEquals("http://localhost:8000",
                client.serviceClientConfiguration().endpointOverride().map(Object::toString).orElse(null));
        }
    }

    @Test
    void usesLocalEndpoint_BlankOrMissing_IsFalse() {
        assertFalse(new DynamoDBConfig("us-east-1", "", TIMEOUT).usesLocalEndpoint());
        assertFalse(new DynamoDBConfig("us-east-1", "  ", TIMEOUT).usesLocalEndpoint());
        assertFalse(new DynamoDBConfig("us-east-1", null, TIMEOUT).usesLocalEndpoint());
    }

    @Test
    void dynamoDbEnhancedClient_ShouldCreateEnhancedClient() {
        DynamoDBConfig config = new DynamoDBConfig("us-east-1", "", TIMEOUT);
        DynamoDbClient mockClient = mock(DynamoDbClient.class);

        DynamoDbEnhancedClient enhancedClient = config.dynamoDbEnhancedClient(mockClient);

        assertNotNull(enhancedClient);
    }
}
