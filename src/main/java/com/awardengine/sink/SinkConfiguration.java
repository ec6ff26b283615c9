package com.awardengine.sink;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SinkConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalAchievementSink localAchievementSink(Clock clock) {
        return new LocalAchievementSink(GerbilPhysicsAchievements.descriptors(), clock);
    }
}
