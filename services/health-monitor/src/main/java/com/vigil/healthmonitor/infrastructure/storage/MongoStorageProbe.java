package com.vigil.healthmonitor.infrastructure.storage;

import com.vigil.monitoring.check.StorageProbe;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Liveness of the document store via the {@code ping} admin command.
 */
public class MongoStorageProbe implements StorageProbe {

    private final MongoTemplate mongoTemplate;

    public MongoStorageProbe(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void ping() {
        Document reply = mongoTemplate.executeCommand(new Document("ping", 1));
        if (!isOk(reply)) {
            throw new IllegalStateException("MongoDB ping returned " + reply.toJson());
        }
    }

    static boolean isOk(Document reply) {
        Object ok = reply.get("ok");
        return ok instanceof Number number ? number.doubleValue() == 1.0 : Boolean.TRUE.equals(ok);
    }
}
