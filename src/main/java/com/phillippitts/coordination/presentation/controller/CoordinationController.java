package com.phillippitts.coordination.presentation.controller;

import com.phillippitts.coordination.domain.AdmissionDecision;
import com.phillippitts.coordination.domain.BatchingAdvice;
import com.phillippitts.coordination.domain.Complexity;
import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.Recommendation;
import com.phillippitts.coordination.exception.AdmissionRejectedException;
import com.phillippitts.coordination.presentation.dto.CompleteRequest;
import com.phillippitts.coordination.presentation.dto.PlanRequest;
import com.phillippitts.coordination.presentation.dto.StartRequest;
import com.phillippitts.coordination.presentation.dto.TimeoutRequest;
import com.phillippitts.coordination.service.orchestration.CoordinationEngine;
import com.phillippitts.coordination.service.orchestration.CoordinationOutcome;
import com.phillippitts.coordination.service.orchestration.InsightsResult;
import com.phillippitts.coordination.service.orchestration.ReportResult;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the coordination engine. Thin adapter: every call delegates to
 * {@link CoordinationEngine}; rejections are raised as exceptions for the global handler.
 */
@RestController
@RequestMapping("/api/coordination")
class CoordinationController {

    private static final Logger LOG = LogManager.getLogger(CoordinationController.class);

    private final CoordinationEngine engine;

    CoordinationController(CoordinationEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/plans")
    ResponseEntity<CoordinationOutcome> plan(@Valid @RequestBody PlanRequest request) {
        CoordinationOutcome outcome = engine.coordinate(request.toWorkItems(), request.allowDegraded());
        if (!outcome.hasPlan()) {
            throw new AdmissionRejectedException(outcome.admission());
        }
        return ResponseEntity.ok(outcome);
    }

    @GetMapping("/admission")
    ResponseEntity<AdmissionDecision> admission(@RequestParam int itemCount) {
        return ResponseEntity.ok(engine.canAdmit(itemCount));
    }

    @GetMapping("/batching")
    ResponseEntity<BatchingAdvice> batching(@RequestParam int itemCount,
                                            @RequestParam(defaultValue = "MEDIUM") Complexity complexity) {
        return ResponseEntity.ok(engine.suggestBatching(itemCount, complexity));
    }

    @PostMapping("/events/{id}/start")
    ResponseEntity<ReportResult> start(@PathVariable String id, @Valid @RequestBody StartRequest request) {
        return ResponseEntity.ok(engine.reportStart(id, request.itemCount(), request.domains(),
                request.strategy(), request.itemKinds()));
    }

    @PostMapping("/events/{id}/complete")
    ResponseEntity<ReportResult> complete(@PathVariable String id, @RequestBody CompleteRequest request) {
        return ResponseEntity.ok(engine.reportComplete(id, request.success(), request.errorMessage()));
    }

    @PostMapping("/events/{id}/timeout")
    ResponseEntity<ReportResult> timeout(@PathVariable String id,
                                         @RequestBody(required = false) TimeoutRequest request) {
        return ResponseEntity.ok(engine.reportTimeout(id, request == null ? null : request.message()));
    }

    @PostMapping("/windows/{id}/close")
    ResponseEntity<Map<String, Object>> closeWindow(@PathVariable String id) {
        boolean closed = engine.closeWindow(id);
        if (!closed) {
            LOG.debug("No open window for id={}", id);
        }
        return ResponseEntity.ok(Map.of("coordinationId", id, "closed", closed));
    }

    @GetMapping("/analytics")
    ResponseEntity<CoordinationAnalytics> analytics() {
        return ResponseEntity.ok(engine.getAnalytics());
    }

    @PostMapping("/insights")
    ResponseEntity<InsightsResult> generateInsights() {
        return ResponseEntity.ok(engine.generateInsights());
    }

    @GetMapping("/insights")
    ResponseEntity<List<Insight>> insights() {
        return ResponseEntity.ok(engine.retainedInsights());
    }

    @GetMapping("/recommendations")
    ResponseEntity<Recommendation> recommend(@RequestParam List<String> domains, @RequestParam int itemCount) {
        return ResponseEntity.ok(engine.recommend(domains, itemCount));
    }
}
