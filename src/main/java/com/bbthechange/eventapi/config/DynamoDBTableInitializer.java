package com.bbthechange.eventapi.config;

import com.bbthechange.eventapi.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

/**
 * Creates the events table on startup when it does not exist yet.
 * Meant for local and test environments; disable with {@code dynamodb.table.init.enabled=false}
 * where the table is provisioned by infrastructure.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {
    
    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);
    
    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;
    private final EventTableProperties tableProperties;
    
    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                    DynamoDbClient dynamoDbClient,
                                    EventTableProperties tableProperties) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
        this.tableProperties = tableProperties;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(tableProperties.getTableName());
    }
    
    void createTableIfNotExists(String tableName) {
        DynamoDbTable<Event> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(Event.class));
        try {
            // describeTable throws ResourceNotFoundException for a missing table
            table.describeTable();
            logger.info("Table {} already exists", tableName);
            
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            // no provisioned throughput given, so the table is created with on-demand billing
            table.createTable();
            try (DynamoDbWaiter waiter = dynamoDbClient.waiter()) {
                waiter.waitUntilTableExists(request -> request.tableName(tableName));
            }
            logger.info("Table {} created", tableName);
        } catch (RuntimeException e) {
            logger.error("Error checking table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }
}
