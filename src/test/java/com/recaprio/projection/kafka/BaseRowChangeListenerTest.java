package com.recaprio.projection.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recaprio.projection.service.BaseRelationService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BaseRowChangeListener Tests")
class BaseRowChangeListenerTest {

    private static final String TOPIC = "base-row-changes";

    @Mock
    private BaseRelationService baseRelationService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private Acknowledgment ack;

    private BaseRowChangeListener listener;

    @BeforeEach
    void setUp() {
        listener = new BaseRowChangeListener(baseRelationService, kafkaTemplate, new ObjectMapper());
    }

    @Test
    void insertReplacesTheRow() {
        listener.consume(record("42", "insert", "{\"FreeGHz\": 4.8, \"region\": \"eu\"}"), ack);

        verify(baseRelationService).replace(42L, Map.of("FreeGHz", 4.8, "region", "eu"));
        verify(ack).acknowledge();
    }

    @Test
    void updateMergesTheGivenColumns() {
        listener.consume(record("42", "UPDATE", "{\"FreeGHz\": 7.2}"), ack);

        verify(baseRelationService).merge(42L, Map.of("FreeGHz", 7.2));
        verify(ack).acknowledge();
    }

    @Test
    void deleteIgnoresTheBody() {
        listener.consume(record("42", "delete", null), ack);

        verify(baseRelationService).delete(42L);
        verify(ack).acknowledge();
    }

    @Test
    @SuppressWarnings("unchecked")
    void malformedJsonGoesToTheDeadLetterTopic() {
        listener.consume(record("42", "update", "{not json"), ack);

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        assertThat(captor.getValue().topic()).isEqualTo(TOPIC + ".DLT");
        assertThat(captor.getValue().headers().lastHeader("error")).isNotNull();
        verifyNoInteractions(baseRelationService);
        verify(ack).acknowledge();
    }

    @Test
    void nonNumericKeyGoesToTheDeadLetterTopic() {
        listener.consume(record("cluster-a", "insert", "{}"), ack);

        verify(kafkaTemplate).send(any(ProducerRecord.class));
        verifyNoInteractions(baseRelationService);
        verify(ack).acknowledge();
    }

    @Test
    void unknownActionGoesToTheDeadLetterTopic() {
        listener.consume(record("42", "upsert", "{}"), ack);

        verify(kafkaTemplate).send(any(ProducerRecord.class));
        verify(baseRelationService, never()).delete(anyLong());
        verify(ack).acknowledge();
    }

    @Test
    void processingFailureLeavesTheOffsetUncommitted() {
        when(baseRelationService.merge(any(), any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> listener.consume(record("42", "update", "{\"FreeGHz\": 2.4}"), ack))
                .isInstanceOf(DataAccessResourceFailureException.class);

        verify(ack, never()).acknowledge();
        verifyNoInteractions(kafkaTemplate);
    }

    private static ConsumerRecord<String, String> record(String key, String action, String value) {
        ConsumerRecord<String, String> record = new ConsumerRecord<>(TOPIC, 0, 0L, key, value);
        if (action != null) {
            record.headers().add("action", action.getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }
}
