package com.awardengine.api;

import com.awardengine.engine.AwardEngine;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static com.awardengine.api.RequestBodies.requireNumber;

/**
 * Level lifecycle hooks called by the hosting gameplay screen.
 */
@RestController
@RequestMapping("/v1/levels")
public class LevelController {

    private final AwardEngine engine;

    public LevelController(AwardEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/{levelName}/start")
    public Map<String, Object> start(@PathVariable String levelName) {
        engine.startLevel(levelName);
        return Map.of("status", "started", "level", levelName);
    }

    /**
     * Body: {@code {"seconds": 31.5}}
     */
    @PostMapping("/{levelName}/complete")
    public Map<String, Object> complete(@PathVariable String levelName, @RequestBody Map<String, Object> body) {
        engine.completeLevel(levelName, requireNumber(body, "seconds"));
        return Map.of("status", "completed", "level", levelName);
    }
}
