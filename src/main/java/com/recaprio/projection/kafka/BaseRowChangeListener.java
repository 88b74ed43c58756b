package com.recaprio.projection.kafka;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recaprio.projection.model.MutationType;
import com.recaprio.projection.service.BaseRelationService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consumes base row changes: record key = cluster id, header {@code action} =
 * insert|update|delete, body = JSON object of column values. Inserts replace the row,
 * updates overlay the given columns, deletes ignore the body.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class BaseRowChangeListener {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final BaseRelationService baseRelationService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public BaseRowChangeListener(BaseRelationService baseRelationService,
                                 KafkaTemplate<String, String> kafkaTemplate,
                                 ObjectMapper objectMapper) {
        this.baseRelationService = baseRelationService;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    // The offset is only committed once the base write (and, when synchronous, its
    // projection) has committed. Processing errors are left to the container's error handler.
    @KafkaListener(id = "baseRowChangesListener",
            topics = "${app.kafka.topics.base-changes:base-row-changes}",
            groupId = "${spring.kafka.consumer.group-id:projection-sync}",
            containerFactory = "manualAckContainerFactory")
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        Long key = parseKey(record.key());
        if (key == null) {
            log.warn("Missing or non-numeric key '{}', sending to DLT", record.key());
            publishToDlt(record, "key must be a numeric cluster id");
            ack.acknowledge();
            return;
        }

        MutationType action = MutationType.fromHeader(getHeader(record, "action"));
        if (action == null) {
            log.warn("Unknown action for key {}, sending to DLT", key);
            publishToDlt(record, "header 'action' must be insert, update or delete");
            ack.acknowledge();
            return;
        }

        log.debug("Received {} for key {}", action, key);

        if (action == MutationType.DELETE) {
            baseRelationService.delete(key);
            ack.acknowledge();
            return;
        }

        Map<String, Object> attributes;
        try {
            attributes = objectMapper.readValue(record.value(), MAP_TYPE);
        } catch (Exception ex) {
            log.warn("Malformed JSON for key {}: {}", key, ex.getMessage());
            publishToDlt(record, ex.getMessage() == null ? "malformed payload" : ex.getMessage());
            ack.acknowledge();
            return;
        }
        if (attributes == null) {
            log.warn("Empty payload for {} of key {}, sending to DLT", action, key);
            publishToDlt(record, "payload must be a JSON object");
            ack.acknowledge();
            return;
        }

        if (action == MutationType.INSERT) {
            baseRelationService.replace(key, attributes);
        } else {
            baseRelationService.merge(key, attributes);
        }
        ack.acknowledge();
    }

    private static Long parseKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(key.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private void publishToDlt(ConsumerRecord<String, String> record, String error) {
        ProducerRecord<String, String> dlt = new ProducerRecord<>(record.topic() + ".DLT", record.key(), record.value());
        dlt.headers().add("error", error.getBytes(StandardCharsets.UTF_8));
        kafkaTemplate.send(dlt);
    }

    private static String getHeader(ConsumerRecord<String, String> record, String key) {
        Header header = record.headers().lastHeader(key);
        if (header == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }
}
