package com.radar.anomaly.consumer;

import com.radar.anomaly.stream.MetricLaneDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.stream.StreamMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metric ingestion from a Redis stream (profile {@code redis-pipeline}). Each record carries the
 * event JSON in its {@code payload} field.
 */
@Component
@Profile("redis-pipeline")
@ConditionalOnProperty(name = "radar.stream.enabled", havingValue = "true")
public class RedisMetricStreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(RedisMetricStreamConsumer.class);

    private final RedisConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;
    private final MetricEventParser parser;
    private final MetricLaneDispatcher dispatcher;
    private final Counter messagesConsumed;
    private final Counter messagesRejected;
    private StreamMessageListenerContainer<String, MapRecord<String, String, String>> container;

    @Value("${radar.redis.stream.name:radar:metrics}")
    private String streamName;

    @Value("${radar.redis.stream.group:radar-anomaly}")
    private String group;

    @Value("${radar.redis.stream.consumer:detector-1}")
    private String consumerName;

    public RedisMetricStreamConsumer(RedisConnectionFactory connectionFactory,
                                     StringRedisTemplate redisTemplate,
                                     MetricEventParser parser,
                                     MetricLaneDispatcher dispatcher,
                                     MeterRegistry meterRegistry) {
        this.connectionFactory = connectionFactory;
        this.redisTemplate = redisTemplate;
        this.parser = parser;
        this.dispatcher = dispatcher;
        this.messagesConsumed = meterRegistry.counter("radar_stream_messages_consumed_total", "source", "redis");
        this.messagesRejected = meterRegistry.counter("radar_stream_messages_rejected_total", "source", "redis");
    }

    @PostConstruct
    public void start() {
        try {
            ensureGroup();

            StreamMessageListenerContainer.StreamMessageListenerContainerOptions<String, MapRecord<String, String, String>> options =
                StreamMessageListenerContainer.StreamMessageListenerContainerOptions
                    .builder()
                    .pollTimeout(Duration.ofSeconds(1))
                    .build();

            container = StreamMessageListenerContainer.create(connectionFactory, options);
            Consumer consumer = Consumer.from(group, consumerName);

            container.receiveAutoAck(consumer, StreamOffset.create(streamName, ReadOffset.lastConsumed()), message -> {
                String payload = message.getValue().get("payload");
                if (payload == null) return;
                parser.parse(payload).ifPresentOrElse(event -> {
                    dispatcher.submit(event);
                    messagesConsumed.increment();
                    if (log.isDebugEnabled()) {
                        log.debug("Consumed stream record id={} key={}", message.getId(), event.key());
                    }
                }, () -> {
                    messagesRejected.increment();
                    log.debug("Rejected stream record {}", message.getId());
                });
            });

            container.start();
            log.info("Redis stream consumer started: stream='{}', group='{}', consumer='{}'", streamName, group, consumerName);
        } catch (Exception e) {
            log.error("Failed to start Redis stream consumer: {}", e.getMessage());
        }
    }

    // Equivalent to: XGROUP CREATE stream group 0-0 MKSTREAM
    private void ensureGroup() {
        try {
            var groupInfos = redisTemplate.hasKey(streamName) ? redisTemplate.opsForStream().groups(streamName) : null;
            boolean groupExists = groupInfos != null && groupInfos.stream().anyMatch(g -> group.equals(g.groupName()));
            if (!groupExists) {
                redisTemplate.opsForStream().createGroup(streamName, ReadOffset.from("0-0"), group);
                log.info("Created Redis Stream group '{}' on '{}' starting at 0-0", group, streamName);
            } else {
                log.info("Redis Stream group '{}' already exists on '{}'", group, streamName);
            }
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (msg.contains("BUSYGROUP")) {
                log.info("Redis Stream group '{}' already exists on '{}' (BUSYGROUP)", group, streamName);
            } else {
                log.warn("Could not ensure Redis Stream group '{}' on '{}': {}", group, streamName, msg);
            }
        }
    }

    @PreDestroy
    public void stop() {
        if (container != null) container.stop();
    }
}
