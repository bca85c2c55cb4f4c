package com.radar.anomaly.rules;

import com.radar.anomaly.error.AnomalyNotFoundException;
import com.radar.anomaly.error.InvalidRuleConfigException;
import com.radar.anomaly.error.RulesUnavailableException;
import com.radar.anomaly.model.AnomalyRule;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.repo.AnomalyRuleRepository;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rule CRUD plus the in-memory lookup index used on the hot path. Readers never lock: every
 * change builds a new {@link RuleIndex} and swaps it in.
 *
 * <p>Each successful load also keeps a threshold-only copy of the index. When reloads keep failing
 * and the index ages past {@code radar.rules.max-index-age-ms}, {@link #resolve} refuses to serve
 * and callers fall back to {@link #resolveThresholdRules}, which reads that copy.
 */
@Service
public class RuleEngine {

  private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

  private final AnomalyRuleRepository repo;
  private final RuleValidator validator;
  private final Clock clock;
  private final Duration maxIndexAge;
  private final AtomicReference<RuleIndex> index = new AtomicReference<>(RuleIndex.EMPTY);
  private final AtomicReference<RuleIndex> thresholdIndex = new AtomicReference<>(RuleIndex.EMPTY);
  private volatile Instant loadedAt;

  public RuleEngine(AnomalyRuleRepository repo,
                    RuleValidator validator,
                    Clock clock,
                    @Value("${radar.rules.max-index-age-ms:300000}") long maxIndexAgeMs) {
    this.repo = repo;
    this.validator = validator;
    this.clock = clock;
    this.maxIndexAge = Duration.ofMillis(maxIndexAgeMs);
  }

  @PostConstruct
  public void init() {
    try {
      reload();
    } catch (DataAccessException e) {
      log.warn("Initial rule load failed, starting with an empty index: {}", e.getMessage());
    }
  }

  @Scheduled(fixedDelayString = "${radar.rules.reload-interval-ms:30000}",
             initialDelayString = "${radar.rules.reload-interval-ms:30000}")
  public void scheduledReload() {
    try {
      reload();
    } catch (DataAccessException e) {
      log.warn("Rule reload failed, keeping previous index: {}", e.getMessage());
    }
  }

  public void reload() {
    List<AnomalyRule> rows = repo.findByActiveTrue();
    RuleIndex next = RuleIndex.build(rows);
    index.set(next);
    thresholdIndex.set(next.only(DetectionMethod.THRESHOLD));
    loadedAt = clock.instant();
    log.debug("Rule index rebuilt: {} active rules", next.size());
  }

  /**
   * Active rules for the exact workspace followed by global defaults for the metric.
   *
   * @throws RulesUnavailableException if no load has succeeded within the max index age
   */
  public List<ResolvedRule> resolve(String workspaceId, String metricType) {
    Instant at = loadedAt;
    if (at == null) {
      throw new RulesUnavailableException("rule index has never loaded");
    }
    if (at.plus(maxIndexAge).isBefore(clock.instant())) {
      throw new RulesUnavailableException("rule index last loaded at " + at);
    }
    return index.get().resolve(workspaceId, metricType);
  }

  public List<ResolvedRule> resolve(MetricKey key) {
    return resolve(key.workspaceId(), key.metricType());
  }

  /** Threshold rules from the last successful load, whatever its age. */
  public List<ResolvedRule> resolveThresholdRules(String workspaceId, String metricType) {
    return thresholdIndex.get().resolve(workspaceId, metricType);
  }

  public int activeRuleCount() {
    return index.get().size();
  }

  // --- CRUD ---

  public List<AnomalyRule> list(String workspaceId) {
    return repo.findByWorkspaceIdOrWorkspaceIdIsNullOrderByCreatedAtAsc(workspaceId);
  }

  public AnomalyRule get(String workspaceId, String ruleId) {
    return repo.findById(ruleId)
        .filter(r -> r.getWorkspaceId() == null || r.getWorkspaceId().equals(workspaceId))
        .orElseThrow(() -> new AnomalyNotFoundException("rule not found: " + ruleId));
  }

  @Transactional
  public AnomalyRule create(String workspaceId, RuleDraft draft, String actor) {
    RuleParameters params = RuleParameters.of(draft.parameters());
    validator.validate(draft.ruleName(), draft.metricType(), draft.method(), params, draft.alertChannels());
    String ownerWs = draft.global() ? null : workspaceId;
    boolean active = draft.active() == null || draft.active();
    if (active) {
      ensureNoActiveDuplicate(ownerWs, draft.metricType(), draft.method(), null);
    }
    AnomalyRule rule = AnomalyRule.create(ownerWs, draft.metricType(), draft.ruleName().trim(),
        draft.method(), actor, clock.instant());
    rule.setParameters(params.asMap());
    rule.setActive(active);
    rule.setAutoAlert(Boolean.TRUE.equals(draft.autoAlert()));
    rule.setAlertChannels(draft.alertChannels());
    AnomalyRule saved = saveActiveUnique(rule);
    log.info("Created rule id={} ws={} metric={} method={}", saved.getId(), ownerWs,
        saved.getMetricType(), saved.getMethod().wireName());
    reloadQuietly();
    return saved;
  }

  @Transactional
  public AnomalyRule update(String workspaceId, String ruleId, RuleDraft draft) {
    AnomalyRule rule = get(workspaceId, ruleId);
    if (draft.metricType() != null && !draft.metricType().equals(rule.getMetricType())) {
      throw new InvalidRuleConfigException("metric_type of an existing rule cannot change");
    }
    if (draft.method() != null && draft.method() != rule.getMethod()) {
      throw new InvalidRuleConfigException("method of an existing rule cannot change");
    }
    String name = draft.ruleName() != null ? draft.ruleName().trim() : rule.getRuleName();
    RuleParameters params = draft.parameters() != null
        ? RuleParameters.of(draft.parameters())
        : RuleParameters.of(rule.getParameters());
    List<String> channels = draft.alertChannels() != null ? draft.alertChannels() : rule.getAlertChannels();
    validator.validate(name, rule.getMetricType(), rule.getMethod(), params, channels);

    boolean active = draft.active() != null ? draft.active() : rule.isActive();
    if (active && !rule.isActive()) {
      ensureNoActiveDuplicate(rule.getWorkspaceId(), rule.getMetricType(), rule.getMethod(), rule.getId());
    }
    rule.setRuleName(name);
    rule.setParameters(params.asMap());
    rule.setAlertChannels(channels);
    rule.setActive(active);
    if (draft.autoAlert() != null) rule.setAutoAlert(draft.autoAlert());
    rule.setUpdatedAt(clock.instant());
    AnomalyRule saved = saveActiveUnique(rule);
    reloadQuietly();
    return saved;
  }

  @Transactional
  public void delete(String workspaceId, String ruleId) {
    AnomalyRule rule = get(workspaceId, ruleId);
    repo.delete(rule);
    log.info("Deleted rule id={} ws={}", ruleId, rule.getWorkspaceId());
    reloadQuietly();
  }

  private void ensureNoActiveDuplicate(String workspaceId, String metricType, DetectionMethod method,
                                       String selfId) {
    List<AnomalyRule> existing = workspaceId == null
        ? repo.findByWorkspaceIdIsNullAndMetricTypeAndMethodAndActiveTrue(metricType, method)
        : repo.findByWorkspaceIdAndMetricTypeAndMethodAndActiveTrue(workspaceId, metricType, method);
    boolean clash = existing.stream().anyMatch(r -> !Objects.equals(r.getId(), selfId));
    if (clash) {
      throw new InvalidRuleConfigException("an active " + method.wireName() + " rule already exists for "
          + (workspaceId == null ? "global" : workspaceId) + "/" + metricType);
    }
  }

  /** Saves and flushes so a concurrent duplicate surfaces here, on the {@code active_key} constraint. */
  private AnomalyRule saveActiveUnique(AnomalyRule rule) {
    try {
      return repo.saveAndFlush(rule);
    } catch (DataIntegrityViolationException e) {
      throw new InvalidRuleConfigException("an active " + rule.getMethod().wireName() + " rule already exists for "
          + (rule.getWorkspaceId() == null ? "global" : rule.getWorkspaceId()) + "/" + rule.getMetricType(), e);
    }
  }

  private void reloadQuietly() {
    try {
      reload();
    } catch (DataAccessException e) {
      log.warn("Rule index refresh failed after change: {}", e.getMessage());
    }
  }

  /** Immutable snapshot of the active rules. */
  static final class RuleIndex {
    static final RuleIndex EMPTY = new RuleIndex(Map.of(), Map.of(), 0);

    private final Map<MetricKey, List<ResolvedRule>> byWorkspace;
    private final Map<String, List<ResolvedRule>> globalByMetric;
    private final int size;

    private RuleIndex(Map<MetricKey, List<ResolvedRule>> byWorkspace,
                      Map<String, List<ResolvedRule>> globalByMetric, int size) {
      this.byWorkspace = byWorkspace;
      this.globalByMetric = globalByMetric;
      this.size = size;
    }

    static RuleIndex build(List<AnomalyRule> rows) {
      Map<MetricKey, List<ResolvedRule>> ws = new HashMap<>();
      Map<String, List<ResolvedRule>> global = new HashMap<>();
      List<AnomalyRule> sorted = new ArrayList<>(rows);
      sorted.sort(Comparator.comparing(AnomalyRule::getCreatedAt));
      int count = 0;
      for (AnomalyRule row : sorted) {
        if (!row.isActive()) continue;
        ResolvedRule rule;
        try {
          rule = ResolvedRule.from(row);
        } catch (RuntimeException e) {
          log.warn("Skipping unreadable rule id={}: {}", row.getId(), e.getMessage());
          continue;
        }
        if (rule.isGlobal()) {
          global.computeIfAbsent(rule.metricType(), k -> new ArrayList<>()).add(rule);
        } else {
          ws.computeIfAbsent(new MetricKey(rule.workspaceId(), rule.metricType()), k -> new ArrayList<>()).add(rule);
        }
        count++;
      }
      ws.replaceAll((k, v) -> List.copyOf(v));
      global.replaceAll((k, v) -> List.copyOf(v));
      return new RuleIndex(Map.copyOf(ws), Map.copyOf(global), count);
    }

    RuleIndex only(DetectionMethod method) {
      Map<MetricKey, List<ResolvedRule>> ws = new HashMap<>();
      Map<String, List<ResolvedRule>> global = new HashMap<>();
      int count = 0;
      for (Map.Entry<MetricKey, List<ResolvedRule>> e : byWorkspace.entrySet()) {
        List<ResolvedRule> kept = e.getValue().stream().filter(r -> r.method() == method).toList();
        if (!kept.isEmpty()) {
          ws.put(e.getKey(), kept);
          count += kept.size();
        }
      }
      for (Map.Entry<String, List<ResolvedRule>> e : globalByMetric.entrySet()) {
        List<ResolvedRule> kept = e.getValue().stream().filter(r -> r.method() == method).toList();
        if (!kept.isEmpty()) {
          global.put(e.getKey(), kept);
          count += kept.size();
        }
      }
      return new RuleIndex(Map.copyOf(ws), Map.copyOf(global), count);
    }

    List<ResolvedRule> resolve(String workspaceId, String metricType) {
      List<ResolvedRule> exact = byWorkspace.getOrDefault(new MetricKey(workspaceId, metricType), List.of());
      List<ResolvedRule> defaults = globalByMetric.getOrDefault(metricType, List.of());
      if (defaults.isEmpty()) return exact;
      if (exact.isEmpty()) return defaults;
      List<ResolvedRule> out = new ArrayList<>(exact.size() + defaults.size());
      out.addAll(exact);
      out.addAll(defaults);
      return out;
    }

    int size() {
      return size;
    }
  }
}
