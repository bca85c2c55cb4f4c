package com.radar.api.config;

import com.radar.anomaly.config.AnomalyCoreConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Pulls in the detection engine. Streaming stays off here ({@code radar.stream.enabled=false}),
 * so the API shares repositories, rules and baselines without consuming metrics.
 */
@Configuration
@Import(AnomalyCoreConfiguration.class)
public class EngineConfig {
}
