package com.radar.api.controller;

import com.radar.anomaly.rules.RuleEngine;
import com.radar.api.model.RuleRequest;
import com.radar.api.model.RuleView;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/anomalies/{workspaceId}/rules")
public class RulesController {

  private final RuleEngine rules;

  public RulesController(RuleEngine rules) {
    this.rules = rules;
  }

  @GetMapping
  public List<RuleView> list(@PathVariable("workspaceId") String workspaceId) {
    return rules.list(workspaceId).stream().map(RuleView::from).toList();
  }

  @GetMapping("/{ruleId}")
  public RuleView get(@PathVariable("workspaceId") String workspaceId, @PathVariable("ruleId") String ruleId) {
    return RuleView.from(rules.get(workspaceId, ruleId));
  }

  @PostMapping
  public ResponseEntity<RuleView> create(@PathVariable("workspaceId") String workspaceId,
                                         @RequestHeader(name = "X-User-Id", required = false) String userId,
                                         @RequestBody RuleRequest body) {
    String actor = userId == null || userId.isBlank() ? AnomaliesController.DEFAULT_ACTOR : userId;
    RuleView created = RuleView.from(rules.create(workspaceId, body.toDraft(), actor));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{ruleId}")
  public RuleView update(@PathVariable("workspaceId") String workspaceId,
                         @PathVariable("ruleId") String ruleId,
                         @RequestBody RuleRequest body) {
    return RuleView.from(rules.update(workspaceId, ruleId, body.toDraft()));
  }

  @DeleteMapping("/{ruleId}")
  public ResponseEntity<Void> delete(@PathVariable("workspaceId") String workspaceId,
                                     @PathVariable("ruleId") String ruleId) {
    rules.delete(workspaceId, ruleId);
    return ResponseEntity.noContent().build();
  }
}
