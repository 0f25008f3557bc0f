package com.bbthechange.eventapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the DynamoDB table holding event records.
 * Injected into the repository and startup components; nothing reads the environment directly.
 */
@Component
@ConfigurationProperties(prefix = "events.dynamodb")
public class EventTableProperties {

    private String tableName = "events";

    public EventTableProperties() {
    }

    public EventTableProperties(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }
}
