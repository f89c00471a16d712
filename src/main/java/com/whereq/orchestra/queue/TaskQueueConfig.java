package com.whereq.orchestra.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.config.OrchestraProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.util.UUID;

/**
 * Task queue beans for the configured backend
 */
@Slf4j
@Configuration
public class TaskQueueConfig {

    @Bean
    @ConditionalOnProperty(prefix = "orchestra", name = "backend", havingValue = "redis", matchIfMissing = true)
    public TaskQueueRegistry redisTaskQueues(ReactiveRedisTemplate<String, String> redisTemplate,
                                             ObjectMapper objectMapper,
                                             OrchestraProperties properties) {
        OrchestraProperties.QueueConfig queue = properties.getQueue();
        String consumerId = UUID.randomUUID().toString();
        log.info("Redis task queues consuming as {}", consumerId);
        return new TaskQueueRegistry(type -> new RedisTaskQueue(redisTemplate, objectMapper, queue.getRetry(),
            queue.getKeyPrefix(), type.queueName(), consumerId, queue.getLeaseTtl()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "orchestra", name = "backend", havingValue = "memory")
    public TaskQueueRegistry inMemoryTaskQueues(ObjectMapper objectMapper, OrchestraProperties properties) {
        log.warn("Using in-memory task queues; waiting tasks are lost on restart");
        return new TaskQueueRegistry(type -> new InMemoryTaskQueue(
            objectMapper, properties.getQueue().getRetry(), type.queueName()));
    }
}
