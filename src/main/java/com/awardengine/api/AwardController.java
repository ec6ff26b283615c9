package com.awardengine.api;

import com.awardengine.engine.AwardEngine;
import com.awardengine.engine.AwardState;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Award evaluation and session control.
 *
 * POST /v1/awards/evaluate              evaluate the whole catalog now
 * POST /v1/awards/{key}/evaluate        evaluate a single award now
 * POST /v1/awards/session/reset         re-arm every award (test/cheat tooling)
 */
@RestController
@RequestMapping("/v1/awards")
public class AwardController {

    private final AwardEngine engine;

    public AwardController(AwardEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public List<AwardState> sessionState() {
        return engine.sessionState();
    }

    @PostMapping("/evaluate")
    public Map<String, Object> evaluate() {
        return Map.of("fired", engine.evaluateAndFire());
    }

    @PostMapping("/{achievementKey}/evaluate")
    public Map<String, Object> evaluateOne(@PathVariable String achievementKey) {
        boolean fired = engine.evaluateNow(achievementKey);
        return Map.of("achievement_key", achievementKey, "fired", fired);
    }

    @PostMapping("/session/reset")
    public Map<String, Object> resetSession() {
        engine.resetSession();
        return Map.of("status", "reset");
    }
}
