package com.radar.anomaly.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class ExecutorConfig {

  public static final String DETECTOR_EXECUTOR = "detectorExecutor";
  public static final String BATCH_EXECUTOR = "batchDetectorExecutor";
  public static final String RETRAIN_EXECUTOR = "retrainExecutor";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Realtime detector calls run here so each one can be timed out on its own. */
  @Bean(name = DETECTOR_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService detectorExecutor(@Value("${radar.detect.realtime-pool-size:16}") int threads) {
    return Executors.newFixedThreadPool(threads, daemon("radar-detect-"));
  }

  @Bean(name = BATCH_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService batchDetectorExecutor(@Value("${radar.detect.batch-pool-size:2}") int threads) {
    return Executors.newFixedThreadPool(threads, daemon("radar-batch-"));
  }

  @Bean(name = RETRAIN_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService retrainExecutor(@Value("${radar.baseline.retrain-pool-size:2}") int threads) {
    return Executors.newFixedThreadPool(threads, daemon("radar-retrain-"));
  }

  private static CustomizableThreadFactory daemon(String prefix) {
    CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
    factory.setDaemon(true);
    return factory;
  }
}
