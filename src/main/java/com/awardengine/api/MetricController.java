package com.awardengine.api;

import com.awardengine.contract.MetricId;
import com.awardengine.engine.AwardEngine;
import com.awardengine.facts.FactSnapshot;
import com.awardengine.facts.KeyFigure;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

import static com.awardengine.api.RequestBodies.optionalString;
import static com.awardengine.api.RequestBodies.requireInt;
import static com.awardengine.api.RequestBodies.requireNumber;

/**
 * Gameplay mutation surface for key figures, plus the debug listing and the
 * suspend/resume snapshot.
 *
 * Metrics are addressed by their wire name, e.g. {@code /v1/metrics/WipeoutsCount/count/delta}.
 */
@RestController
@RequestMapping("/v1/metrics")
public class MetricController {

    private final AwardEngine engine;

    public MetricController(AwardEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public List<KeyFigure> keyFigures() {
        return engine.keyFigures();
    }

    @PutMapping("/{metric}/count")
    public Map<String, Object> setCount(@PathVariable String metric, @RequestBody Map<String, Object> body) {
        MetricId id = MetricId.fromValue(metric);
        engine.setCountAbsolute(id, requireInt(body, "value"));
        return accepted(id);
    }

    @PostMapping("/{metric}/count/delta")
    public Map<String, Object> addCountDelta(@PathVariable String metric, @RequestBody Map<String, Object> body) {
        MetricId id = MetricId.fromValue(metric);
        engine.addCountDelta(id, requireInt(body, "delta"));
        return accepted(id);
    }

    @PostMapping("/{metric}/count/max")
    public Map<String, Object> keepMaximumCount(@PathVariable String metric, @RequestBody Map<String, Object> body) {
        MetricId id = MetricId.fromValue(metric);
        engine.keepMaximumCount(id, requireInt(body, "candidate"));
        return accepted(id);
    }

    @PutMapping("/{metric}/timer")
    public Map<String, Object> setTimer(@PathVariable String metric, @RequestBody Map<String, Object> body) {
        MetricId id = MetricId.fromValue(metric);
        engine.setTimerAbsolute(id, requireNumber(body, "seconds"));
        return accepted(id);
    }

    @PostMapping("/{metric}/timer/max")
    public Map<String, Object> keepMaximumTimer(@PathVariable String metric, @RequestBody Map<String, Object> body) {
        MetricId id = MetricId.fromValue(metric);
        engine.keepMaximumTimer(id, requireNumber(body, "candidate"));
        return accepted(id);
    }

    @PutMapping("/{metric}/label")
    public Map<String, Object> setLabel(@PathVariable String metric, @RequestBody Map<String, Object> body) {
        MetricId id = MetricId.fromValue(metric);
        engine.setLabel(id, optionalString(body, "label"));
        return accepted(id);
    }

    @DeleteMapping("/{metric}")
    public Map<String, Object> wipe(@PathVariable String metric) {
        MetricId id = MetricId.fromValue(metric);
        engine.wipe(id);
        return accepted(id);
    }

    @PostMapping("/instance/wipe")
    public Map<String, Object> wipeInstanceMetrics() {
        engine.wipeAllInstanceMetrics();
        return Map.of("status", "wiped");
    }

    @GetMapping("/snapshot")
    public FactSnapshot snapshot() {
        return engine.snapshot();
    }

    @PutMapping("/snapshot")
    public Map<String, Object> restore(@RequestBody FactSnapshot snapshot) {
        engine.restore(snapshot);
        return Map.of("status", "restored", "slots", snapshot.slots().size());
    }

    private Map<String, Object> accepted(MetricId id) {
        return Map.of("status", "accepted", "metric", id.getValue());
    }
}
