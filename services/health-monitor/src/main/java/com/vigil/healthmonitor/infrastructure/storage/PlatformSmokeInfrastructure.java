package com.vigil.healthmonitor.infrastructure.storage;

import com.vigil.healthmonitor.infrastructure.queue.RedisQueueStatsSource;
import com.vigil.monitoring.smoke.SmokeInfrastructure;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Shared infrastructure touched by the infrastructure smoke tests: the Redis cache, the MongoDB
 * document store and the BullMQ scheduler.
 */
public class PlatformSmokeInfrastructure implements SmokeInfrastructure {

    private final RedisStorageProbe cache;
    private final MongoTemplate mongoTemplate;
    private final RedisQueueStatsSource queues;
    private final List<String> queueNames;

    public PlatformSmokeInfrastructure(RedisStorageProbe cache, MongoTemplate mongoTemplate,
                                       RedisQueueStatsSource queues, List<String> queueNames) {
        this.cache = cache;
        this.mongoTemplate = mongoTemplate;
        this.queues = queues;
        this.queueNames = List.copyOf(queueNames);
    }

    @Override
    public String pingCache() {
        return cache.reply();
    }

    @Override
    public Map<String, Object> documentStoreStats() {
        Document stats = mongoTemplate.executeCommand(new Document("dbStats", 1));
        return new LinkedHashMap<>(stats);
    }

    @Override
    public long scheduledJobCount() {
        return queues.repeatableJobCount(queueNames);
    }
}
