package com.example.bridge.config;

import com.example.bridge.event.MappingEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, MappingEvent> mappingEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, MappingEvent> mappingEventKafkaTemplate(
            ProducerFactory<String, MappingEvent> mappingEventProducerFactory) {
        return new KafkaTemplate<>(mappingEventProducerFactory);
    }

    @Bean
    public NewTopic mappingLifecycleTopic(BridgeProperties bridgeProperties) {
        return TopicBuilder.name(bridgeProperties.getEvents().getTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
