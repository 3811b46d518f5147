package com.acdm.market.acdm_market;

import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.acdm.market.acdm_market.config.MarketProperties;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Fails startup early when the market database is unreachable.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "market.persistence.enabled", havingValue = "true", matchIfMissing = true)
public class MongoStartUpCheck {

    @Autowired
    MongoClient mongoClient;

    @Autowired
    MarketProperties marketProperties;

    @PostConstruct
    public void checkMongoConnection() {
        String databaseName = marketProperties.getPersistence().getDatabase();
        try {
            MongoDatabase database = mongoClient.getDatabase(databaseName);
            database.runCommand(new Document("ping", 1));
            Document state = database.getCollection("market_state").find().first();
            if (state != null) {
                log.info("MongoDB connection successful, found market state in {}", databaseName);
            } else {
                log.info("MongoDB connection successful, {} holds no market state yet", databaseName);
            }
        } catch (Exception e) {
            throw new IllegalStateException("MongoDB connection failed for " + databaseName, e);
        }
    }
}
