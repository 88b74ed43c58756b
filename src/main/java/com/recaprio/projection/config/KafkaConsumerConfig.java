package com.recaprio.projection.config;

import com.recaprio.projection.exception.DomainException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

@Slf4j
@Configuration
@EnableConfigurationProperties(ChangeFeedProperties.class)
@ConditionalOnProperty(name = "app.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConsumerConfig {

    static final String DEAD_LETTER_SUFFIX = ".DLT";

    /**
     * Manual-ack container for the change feed. Offsets are acknowledged by the listener
     * once the base write has committed.
     */
    @Bean(name = "manualAckContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<Object, Object> manualAckContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            DefaultErrorHandler changeFeedErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        factory.setCommonErrorHandler(changeFeedErrorHandler);
        return factory;
    }

    /**
     * Redelivers a failing record per {@code app.kafka.redelivery}, then publishes it to
     * {@code <topic>.DLT} keyed as it came in. Records the service can never accept skip
     * the redeliveries.
     */
    @Bean
    public DefaultErrorHandler changeFeedErrorHandler(KafkaTemplate<String, String> kafkaTemplate,
                                                      ChangeFeedProperties properties) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (record, ex) -> new TopicPartition(record.topic() + DEAD_LETTER_SUFFIX, -1));
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, redeliveryBackOff(properties));
        errorHandler.addNotRetryableExceptions(IllegalArgumentException.class, DomainException.class);
        errorHandler.setCommitRecovered(true);
        errorHandler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Change feed record {}-{}@{} failed (delivery {}): {}",
                        record.topic(), record.partition(), record.offset(), deliveryAttempt, ex.getMessage()));
        return errorHandler;
    }

    static FixedBackOff redeliveryBackOff(ChangeFeedProperties properties) {
        ChangeFeedProperties.Redelivery redelivery = properties.getRedelivery();
        return new FixedBackOff(redelivery.getInterval().toMillis(), redelivery.getAttempts());
    }
}
