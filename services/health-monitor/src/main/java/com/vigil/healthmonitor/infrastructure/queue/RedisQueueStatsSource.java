package com.vigil.healthmonitor.infrastructure.queue;

import com.vigil.monitoring.check.QueueStats;
import com.vigil.monitoring.check.QueueStatsSource;
import java.util.List;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Reads BullMQ job counts straight from Redis. Waiting and active jobs are lists, the other
 * states are sorted sets.
 */
public class RedisQueueStatsSource implements QueueStatsSource {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisQueueStatsSource(StringRedisTemplate redis, String prefix) {
        this.redis = redis;
        this.prefix = prefix;
    }

    @Override
    public QueueStats stats(String queueName) {
        BullQueueKeys keys = new BullQueueKeys(prefix, queueName);
        return new QueueStats(
                listSize(keys.waiting()),
                listSize(keys.active()),
                setSize(keys.completed()),
                setSize(keys.failed()),
                setSize(keys.delayed()));
    }

    /**
     * Total number of repeatable (scheduled) jobs registered across the given queues.
     */
    public long repeatableJobCount(List<String> queueNames) {
        long total = 0;
        for (String queue : queueNames) {
            total += setSize(new BullQueueKeys(prefix, queue).repeatable());
        }
        return total;
    }

    private long listSize(String key) {
        Long size = redis.opsForList().size(key);
        return size != null ? size : 0L;
    }

    private long setSize(String key) {
        Long size = redis.opsForZSet().zCard(key);
        return size != null ? size : 0L;
    }
}
