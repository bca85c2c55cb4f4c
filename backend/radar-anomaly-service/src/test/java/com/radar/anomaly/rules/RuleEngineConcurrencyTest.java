package com.radar.anomaly.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.radar.anomaly.MutableClock;
import com.radar.anomaly.error.InvalidRuleConfigException;
import com.radar.anomaly.model.AnomalyRule;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.repo.AnomalyRuleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@Import({RuleEngine.class, RuleValidator.class, RuleEngineConcurrencyTest.Config.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class RuleEngineConcurrencyTest {

  @TestConfiguration
  static class Config {
    @Bean
    Clock clock() {
      return new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    }
  }

  @Autowired
  private RuleEngine engine;

  @Autowired
  private AnomalyRuleRepository repo;

  @AfterEach
  void cleanUp() {
    repo.deleteAll();
  }

  private static RuleDraft zscoreDraft(String name) {
    return new RuleDraft(name, "latency_ms", DetectionMethod.ZSCORE, Map.of("sensitivity", 3.0), null, null,
        List.of(), false);
  }

  @Test
  void concurrentCreatesLeaveOneActiveRule() throws Exception {
    int writers = 4;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<AnomalyRule>> results = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        String name = "latency z " + i;
        results.add(pool.submit(() -> {
          start.await();
          return engine.create("ws-1", zscoreDraft(name), "alice");
        }));
      }
      start.countDown();
      int created = 0;
      int rejected = 0;
      for (Future<AnomalyRule> f : results) {
        try {
          f.get(30, TimeUnit.SECONDS);
          created++;
        } catch (ExecutionException e) {
          assertThat(e.getCause()).isInstanceOf(InvalidRuleConfigException.class);
          rejected++;
        }
      }

      assertThat(created).isEqualTo(1);
      assertThat(rejected).isEqualTo(writers - 1);
      assertThat(repo.findByActiveTrue()).hasSize(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void deactivatedRuleFreesTheSlot() {
    AnomalyRule first = engine.create("ws-1", zscoreDraft("first"), "alice");
    engine.update("ws-1", first.getId(), new RuleDraft(null, null, null, null, false, null, null, false));

    AnomalyRule second = engine.create("ws-1", zscoreDraft("second"), "bob");
    assertThat(second.isActive()).isTrue();
    assertThat(repo.count()).isEqualTo(2);

    assertThatThrownBy(() -> engine.update("ws-1", first.getId(),
        new RuleDraft(null, null, null, null, true, null, null, false)))
        .isInstanceOf(InvalidRuleConfigException.class);
  }
}
