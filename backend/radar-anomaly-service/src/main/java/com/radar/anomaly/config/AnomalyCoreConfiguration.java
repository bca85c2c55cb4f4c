package com.radar.anomaly.config;

import com.radar.anomaly.RadarAnomalyApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.TypeExcludeFilter;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.FilterType;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Everything the detection engine needs, importable by other services. Ingestion, lanes and
 * batch schedulers only start when {@code radar.stream.enabled=true}.
 */
@Configuration
@EnableScheduling
@ComponentScan(
    basePackages = "com.radar.anomaly",
    excludeFilters = {
      @ComponentScan.Filter(type = FilterType.CUSTOM, classes = TypeExcludeFilter.class),
      @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = RadarAnomalyApplication.class)
    })
@EnableJpaRepositories(basePackages = "com.radar.anomaly.repo")
@EntityScan(basePackages = "com.radar.anomaly.model")
public class AnomalyCoreConfiguration {
}
