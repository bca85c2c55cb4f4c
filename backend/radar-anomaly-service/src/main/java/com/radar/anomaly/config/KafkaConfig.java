package com.radar.anomaly.config;

import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
@EnableKafka
public class KafkaConfig {

  /** Alerts are Avro-encoded up front, so the wire value is plain bytes. */
  @Bean
  public ProducerFactory<String, byte[]> alertProducerFactory(KafkaProperties properties) {
    return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null),
        new StringSerializer(), new ByteArraySerializer());
  }

  @Bean
  public KafkaTemplate<String, byte[]> alertKafkaTemplate(ProducerFactory<String, byte[]> alertProducerFactory) {
    return new KafkaTemplate<>(alertProducerFactory);
  }
}
