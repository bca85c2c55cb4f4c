package com.radar.anomaly.consumer;

import com.radar.anomaly.stream.MetricLaneDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

@Component
@Profile("!redis-pipeline")
@ConditionalOnProperty(name = "radar.stream.enabled", havingValue = "true")
public class MetricEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(MetricEventConsumer.class);

    private final MetricEventParser parser;
    private final MetricLaneDispatcher dispatcher;
    private final Counter messagesConsumed;
    private final Counter messagesRejected;

    public MetricEventConsumer(MetricEventParser parser, MetricLaneDispatcher dispatcher, MeterRegistry metrics) {
        this.parser = parser;
        this.dispatcher = dispatcher;
        this.messagesConsumed = metrics.counter("radar_stream_messages_consumed_total", "source", "kafka");
        this.messagesRejected = metrics.counter("radar_stream_messages_rejected_total", "source", "kafka");
    }

    @KafkaListener(
        topics = "${radar.kafka.topics.metrics:radar.metrics}",
        concurrency = "${radar.kafka.concurrency:3}"
    )
    public void onMessage(
            String payload,
            @Header(name = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(name = KafkaHeaders.OFFSET, required = false) Long offset) {

        parser.parse(payload).ifPresentOrElse(event -> {
            dispatcher.submit(event);
            messagesConsumed.increment();
        }, messagesRejected::increment);

        log.debug("Processed message from partition={} offset={}", partition, offset);
    }
}
