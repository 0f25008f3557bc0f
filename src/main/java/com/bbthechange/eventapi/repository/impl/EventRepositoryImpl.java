package com.bbthechange.eventapi.repository.impl;

import com.bbthechange.eventapi.config.EventTableProperties;
import com.bbthechange.eventapi.exception.RepositoryException;
import com.bbthechange.eventapi.model.Event;
import com.bbthechange.eventapi.repository.EventRepository;
import com.bbthechange.eventapi.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * EventRepository backed by a single DynamoDB table through the enhanced client.
 */
@Repository
public class EventRepositoryImpl implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(EventRepositoryImpl.class);

    // "status" is a DynamoDB reserved word and has to go through an expression name
    static final String STATUS_FILTER = "#status = :status";

    private final DynamoDbTable<Event> eventTable;
    private final String tableName;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public EventRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                               EventTableProperties tableProperties,
                               QueryPerformanceTracker queryTracker) {
        this.tableName = tableProperties.getTableName();
        this.eventTable = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(Event.class));
        this.queryTracker = queryTracker;
    }

    @Override
    public Event save(Event event) {
        return queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                eventTable.putItem(event);
                logger.debug("Saved event {}", event.getEventId());
                return event;
            } catch (SdkException e) {
                logger.error("Failed to save event {}", event.getEventId(), e);
                throw new RepositoryException("PutItem", "Failed to put item in DynamoDB: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Optional<Event> findById(String eventId) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                Event event = eventTable.getItem(key(eventId));
                return Optional.ofNullable(event);
            } catch (SdkException e) {
                logger.error("Failed to get event {}", eventId, e);
                throw new RepositoryException("GetItem", "Failed to get item from DynamoDB: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public List<Event> findAll(Optional<String> status) {
        return queryTracker.trackQuery("Scan", tableName, () -> {
            try {
                ScanEnhancedRequest.Builder request = ScanEnhancedRequest.builder();
                status.ifPresent(value -> request.filterExpression(Expression.builder()
                        .expression(STATUS_FILTER)
                        .putExpressionName("#status", "status")
                        .putExpressionValue(":status", AttributeValue.builder().s(value).build())
                        .build()));

                // items() keeps requesting pages until LastEvaluatedKey is absent
                List<Event> events = eventTable.scan(request.build())
                        .items()
                        .stream()
                        .collect(Collectors.toList());

                logger.debug("Scanned {} events (status filter: {})", events.size(), status.orElse("none"));
                return events;
            } catch (SdkException e) {
                logger.error("Failed to scan events (status filter: {})", status.orElse("none"), e);
                throw new RepositoryException("Scan", "Failed to scan items from DynamoDB: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public boolean deleteById(String eventId) {
        return queryTracker.trackQuery("DeleteItem", tableName, () -> {
            try {
                // the enhanced client returns the old item, so a null means nothing was stored
                Event removed = eventTable.deleteItem(key(eventId));
                return removed != null;
            } catch (SdkException e) {
                logger.error("Failed to delete event {}", eventId, e);
                throw new RepositoryException("DeleteItem", "Failed to delete item from DynamoDB: " + e.getMessage(), e);
            }
        });
    }

    private Key key(String eventId) {
        return Key.builder().partitionValue(eventId).build();
    }
}
