package com.bbthechange.eventapi.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Actuator health check: the service is only healthy while the events table is ACTIVE.
 */
@Component("dynamoDb")
public class DynamoDbHealthIndicator implements HealthIndicator {
    
    private final DynamoDbClient dynamoDbClient;
    private final EventTableProperties tableProperties;
    
    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, EventTableProperties tableProperties) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableProperties = tableProperties;
    }
    
    @Override
    public Health health() {
        String tableName = tableProperties.getTableName();
        try {
            TableDescription table = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(tableName).build()
            ).table();
            
            if (table.tableStatus() == TableStatus.ACTIVE) {
                Health.Builder up = Health.up()
                    .withDetail("table", tableName)
                    .withDetail("status", table.tableStatusAsString());
                if (table.itemCount() != null) {
                    up.withDetail("itemCount", table.itemCount());
                }
                return up.build();
            }
            return Health.down()
                .withDetail("table", tableName)
                .withDetail("status", table.tableStatusAsString())
                .withDetail("reason", "Events table not active")
                .build();
            
        } catch (SdkException e) {
            return Health.down()
                .withDetail("table", tableName)
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
