package com.awardengine.api;

import com.awardengine.sink.LocalAchievementSink;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read side of the local achievement ledger, for an achievements screen.
 */
@RestController
@RequestMapping("/v1/achievements")
public class AchievementController {

    private final LocalAchievementSink achievements;

    public AchievementController(LocalAchievementSink achievements) {
        this.achievements = achievements;
    }

    @GetMapping
    public Map<String, Object> list() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", achievements.summary());
        body.put("achievements", achievements.achievements());
        return body;
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        achievements.clearEarned();
        return Map.of("status", "cleared");
    }
}
