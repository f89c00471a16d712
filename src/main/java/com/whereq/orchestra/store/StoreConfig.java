package com.whereq.orchestra.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.config.OrchestraProperties;
import com.whereq.orchestra.model.Execution;
import com.whereq.orchestra.model.Job;
import com.whereq.orchestra.model.Playbook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.util.Set;

/**
 * Record store beans for the configured backend
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "orchestra", name = "backend", havingValue = "redis", matchIfMissing = true)
    static class Redis {

        @Bean
        RecordStore<Job> jobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                  ObjectMapper objectMapper, OrchestraProperties properties) {
            return new RedisRecordStore<>(redisTemplate, objectMapper,
                properties.getQueue().getKeyPrefix(), "job", Job.class, Set.of());
        }

        @Bean
        RecordStore<Execution> executionStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                              ObjectMapper objectMapper, OrchestraProperties properties) {
            return new RedisRecordStore<>(redisTemplate, objectMapper,
                properties.getQueue().getKeyPrefix(), "execution", Execution.class, Set.of());
        }

        @Bean
        RecordStore<Playbook> playbookStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                            ObjectMapper objectMapper, OrchestraProperties properties) {
            return new RedisRecordStore<>(redisTemplate, objectMapper,
                properties.getQueue().getKeyPrefix(), "playbook", Playbook.class, Playbook.ATTRIBUTE_FIELDS);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "orchestra", name = "backend", havingValue = "memory")
    static class Memory {

        @Bean
        RecordStore<Job> jobStore(ObjectMapper objectMapper) {
            log.warn("Using in-memory record store; records are lost on restart");
            return new InMemoryRecordStore<>(objectMapper, "job", Job.class, Set.of());
        }

        @Bean
        RecordStore<Execution> executionStore(ObjectMapper objectMapper) {
            return new InMemoryRecordStore<>(objectMapper, "execution", Execution.class, Set.of());
        }

        @Bean
        RecordStore<Playbook> playbookStore(ObjectMapper objectMapper) {
            return new InMemoryRecordStore<>(objectMapper, "playbook", Playbook.class, Playbook.ATTRIBUTE_FIELDS);
        }
    }
}
