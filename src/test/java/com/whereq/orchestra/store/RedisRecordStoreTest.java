package com.whereq.orchestra.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.TestObjectMappers;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.Playbook;
import com.whereq.orchestra.model.PlaybookStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Key layout and attribute handling of the Redis record store, checked against a mocked template
 */
class RedisRecordStoreTest {

    private static final String DOC = "orchestra:playbook:pb-1";
    private static final String ATTRS = DOC + ":attrs";

    private final ObjectMapper objectMapper = TestObjectMappers.create();

    private ReactiveRedisTemplate<String, String> redisTemplate;
    private ReactiveValueOperations<String, String> valueOps;
    private ReactiveHashOperations<String, String, String> hashOps;
    private RedisRecordStore<Playbook> store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(ReactiveRedisTemplate.class);
        valueOps = mock(ReactiveValueOperations.class);
        hashOps = mock(ReactiveHashOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.<String, String>opsForHash()).thenReturn(hashOps);
        store = new RedisRecordStore<>(redisTemplate, objectMapper, "orchestra", "playbook",
            Playbook.class, Playbook.ATTRIBUTE_FIELDS);
    }

    @Test
    void createWritesDocumentAndSeedsAttributes() throws Exception {
        when(valueOps.setIfAbsent(eq(DOC), anyString())).thenReturn(Mono.just(true));
        when(hashOps.putAll(eq(ATTRS), anyMap())).thenReturn(Mono.just(true));

        Playbook created = store.create(Playbook.builder().id("pb-1").name("web").content("- hosts: all").build()).block();

        assertThat(created.getCreatedAt()).isNotNull();
        ArgumentCaptor<String> document = ArgumentCaptor.forClass(String.class);
        verify(valueOps).setIfAbsent(eq(DOC), document.capture());
        JsonNode written = objectMapper.readTree(document.getValue());
        assertThat(written.get("name").asText()).isEqualTo("web");
        assertThat(written.has(Playbook.EXECUTION_COUNT)).isFalse();
        assertThat(written.has(Playbook.VERSION)).isFalse();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> attributes = ArgumentCaptor.forClass(Map.class);
        verify(hashOps).putAll(eq(ATTRS), attributes.capture());
        assertThat(attributes.getValue())
            .containsEntry(Playbook.VERSION, "1")
            .containsEntry(Playbook.EXECUTION_COUNT, "0");
    }

    @Test
    void createRejectsExistingId() {
        when(valueOps.setIfAbsent(eq(DOC), anyString())).thenReturn(Mono.just(false));
        when(hashOps.putAll(eq(ATTRS), anyMap())).thenReturn(Mono.just(true));

        StepVerifier.create(store.create(Playbook.builder().id("pb-1").name("web").build()))
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    void saveRewritesDocumentOnlyAndLeavesCountersAlone() throws Exception {
        when(valueOps.setIfPresent(eq(DOC), anyString())).thenReturn(Mono.just(true));
        Playbook stale = Playbook.builder().id("pb-1").name("web").executionCount(0).version(1)
            .status(PlaybookStatus.VALIDATED).build();

        StepVerifier.create(store.save(stale))
            .assertNext(saved -> assertThat(saved.getUpdatedAt()).isNotNull())
            .verifyComplete();

        ArgumentCaptor<String> document = ArgumentCaptor.forClass(String.class);
        verify(valueOps).setIfPresent(eq(DOC), document.capture());
        JsonNode written = objectMapper.readTree(document.getValue());
        assertThat(written.get("status").asText()).isEqualTo("VALIDATED");
        assertThat(written.has(Playbook.EXECUTION_COUNT)).isFalse();
        verify(hashOps, never()).putAll(anyString(), anyMap());
        verify(hashOps, never()).put(anyString(), anyString(), anyString());
    }

    @Test
    void saveOfUnknownRecordIsNotFound() {
        when(valueOps.setIfPresent(eq(DOC), anyString())).thenReturn(Mono.just(false));

        StepVerifier.create(store.save(Playbook.builder().id("pb-1").build()))
            .expectError(RecordNotFoundException.class)
            .verify();
    }

    @Test
    void incrementUsesHashIncrement() {
        when(redisTemplate.hasKey(DOC)).thenReturn(Mono.just(true));
        when(hashOps.increment(ATTRS, Playbook.EXECUTION_COUNT, 1L)).thenReturn(Mono.just(7L));

        StepVerifier.create(store.increment("pb-1", Playbook.EXECUTION_COUNT, 1))
            .expectNext(7L)
            .verifyComplete();
    }

    @Test
    void incrementOfUnknownRecordIsNotFound() {
        when(redisTemplate.hasKey(DOC)).thenReturn(Mono.just(false));

        StepVerifier.create(store.increment("pb-1", Playbook.EXECUTION_COUNT, 1))
            .expectError(RecordNotFoundException.class)
            .verify();
        verify(hashOps, never()).increment(anyString(), anyString(), anyLong());
    }

    @Test
    void onlyAttributeFieldsCanBeIncremented() {
        assertThatThrownBy(() -> store.increment("pb-1", "name", 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findByIdLaysAttributesOverDocument() {
        when(valueOps.get(DOC)).thenReturn(Mono.just(
            "{\"id\":\"pb-1\",\"name\":\"web\",\"status\":\"DRAFT\",\"executionCount\":0}"));
        when(hashOps.entries(ATTRS)).thenReturn(Flux.just(
            Map.entry(Playbook.EXECUTION_COUNT, "5"),
            Map.entry(Playbook.VERSION, "3"),
            Map.entry(Playbook.LAST_EXECUTED_AT, "2026-01-01T10:00:00Z")));

        StepVerifier.create(store.findById("pb-1"))
            .assertNext(playbook -> {
                assertThat(playbook.getName()).isEqualTo("web");
                assertThat(playbook.getExecutionCount()).isEqualTo(5);
                assertThat(playbook.getVersion()).isEqualTo(3);
                assertThat(playbook.getLastExecutedAt()).hasToString("2026-01-01T10:00:00Z");
            })
            .verifyComplete();
    }

    @Test
    void findByIdOfUnknownRecordIsEmpty() {
        when(valueOps.get(DOC)).thenReturn(Mono.empty());
        when(hashOps.entries(ATTRS)).thenReturn(Flux.empty());

        StepVerifier.create(store.findById("pb-1")).verifyComplete();
    }
}
