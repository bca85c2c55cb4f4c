package com.radar.api.controller;

import com.radar.anomaly.baseline.BaselineStore;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.rules.RuleValidator;
import com.radar.api.model.BaselineView;
import com.radar.api.model.TrainRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/anomalies/{workspaceId}/baseline")
public class BaselinesController {

  private static final Logger log = LoggerFactory.getLogger(BaselinesController.class);

  static final int DEFAULT_TRAINING_WINDOW_DAYS = 90;

  private final BaselineStore baselines;

  public BaselinesController(BaselineStore baselines) {
    this.baselines = baselines;
  }

  @GetMapping
  public List<BaselineView> list(@PathVariable("workspaceId") String workspaceId) {
    return baselines.list(workspaceId).stream().map(BaselineView::from).toList();
  }

  @PostMapping("/train")
  public BaselineView train(@PathVariable("workspaceId") String workspaceId, @RequestBody TrainRequest body) {
    RuleValidator.requireSupportedMetric(body.metricType());
    int days = body.trainingWindowDays() == null ? DEFAULT_TRAINING_WINDOW_DAYS : body.trainingWindowDays();
    if (days < 1 || days > 365) {
      throw new IllegalArgumentException("training_window_days must be between 1 and 365");
    }
    MetricKey key = new MetricKey(workspaceId, body.metricType());
    log.info("Baseline training requested for {} over {} days", key, days);
    return BaselineView.from(baselines.retrain(key, days));
  }
}
